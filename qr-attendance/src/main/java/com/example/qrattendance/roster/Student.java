package com.example.qrattendance.roster;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "students", indexes = {
    @Index(name = "idx_students_academy", columnList = "academy_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Student {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "academy_id", nullable = false, length = 64)
    private String academyId;

    @Builder.Default
    @Column(nullable = false)
    private Boolean enabled = true;
}
