package com.example.qrattendance.attendance;

import com.example.qrattendance.entity.AttendanceOutcome;
import com.example.qrattendance.entity.AttendanceStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "attendance_record", uniqueConstraints = {
    @UniqueConstraint(name = "uk_attendance_student_class_date",
        columnNames = {"student_id", "class_id", "lesson_date"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttendanceRecord {

    public static final String SOURCE_QR = "QR";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "student_id", nullable = false, length = 64)
    private String studentId;

    @Column(name = "class_id", nullable = false, length = 64)
    private String classId;

    @Column(name = "academy_id", length = 64)
    private String academyId;

    @Column(name = "lesson_date", nullable = false)
    private LocalDate lessonDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AttendanceStatus status;

    @Column(name = "check_in_time", nullable = false)
    private Instant checkInTime;

    @Column(nullable = false, length = 16)
    private String source;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public static AttendanceRecord from(AttendanceOutcome outcome) {
        return AttendanceRecord.builder()
            .studentId(outcome.getStudentId())
            .classId(outcome.getClassId())
            .academyId(outcome.getAcademyId())
            .lessonDate(outcome.getDate())
            .status(outcome.getStatus())
            .checkInTime(outcome.getCheckInTime())
            .source(SOURCE_QR)
            .build();
    }

    public AttendanceOutcome toOutcome() {
        return AttendanceOutcome.builder()
            .studentId(studentId)
            .classId(classId)
            .academyId(academyId)
            .date(lessonDate)
            .status(status)
            .checkInTime(checkInTime)
            .build();
    }
}
