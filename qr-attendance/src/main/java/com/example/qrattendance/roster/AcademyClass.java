package com.example.qrattendance.roster;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

@Entity
@Table(name = "classes", indexes = {
    @Index(name = "idx_classes_academy", columnList = "academy_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AcademyClass {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "academy_id", nullable = false, length = 64)
    private String academyId;

    /** 정규 수업 시작 시간, 미지정 시 요청값 또는 기본값 사용 */
    @Column(name = "start_time")
    private LocalTime startTime;
}
