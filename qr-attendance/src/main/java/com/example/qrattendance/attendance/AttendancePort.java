package com.example.qrattendance.attendance;

import com.example.qrattendance.entity.AttendanceOutcome;

import java.time.LocalDate;
import java.util.Optional;

/**
 * 출석 기록 저장소 (외부 협력 컴포넌트).
 * (studentId, classId, date) 당 최대 하나의 기록만 존재해야 한다.
 */
public interface AttendancePort {

    /**
     * 기록이 없을 때만 원자적으로 저장한다. 이미 있으면 기존 기록을 함께 반환한다.
     */
    InsertResult tryInsertAttendance(AttendanceOutcome outcome);

    Optional<AttendanceOutcome> findAttendance(String studentId, String classId, LocalDate date);
}
