package com.example.qrattendance.attendance;

import com.example.qrattendance.entity.AttendanceOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Uniqueness is enforced by the (student_id, class_id, lesson_date) constraint, so two
 * concurrent inserts for the same student can never both succeed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaAttendanceAdapter implements AttendancePort {

    private final AttendanceRecordRepository attendanceRecordRepository;

    // Not transactional: the failed insert must roll back on its own before the existing row is read.
    @Override
    public InsertResult tryInsertAttendance(AttendanceOutcome outcome) {
        try {
            attendanceRecordRepository.saveAndFlush(AttendanceRecord.from(outcome));
            log.debug("Inserted attendance for student: {} class: {} date: {}",
                outcome.getStudentId(), outcome.getClassId(), outcome.getDate());
            return InsertResult.inserted();
        } catch (DataIntegrityViolationException e) {
            AttendanceOutcome existing = findAttendance(outcome.getStudentId(), outcome.getClassId(), outcome.getDate())
                .orElseThrow(() -> e);
            log.info("Attendance already recorded for student: {} class: {} date: {}",
                outcome.getStudentId(), outcome.getClassId(), outcome.getDate());
            return InsertResult.duplicate(existing);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AttendanceOutcome> findAttendance(String studentId, String classId, LocalDate date) {
        return attendanceRecordRepository.findByStudentIdAndClassIdAndLessonDate(studentId, classId, date)
            .map(AttendanceRecord::toOutcome);
    }
}
