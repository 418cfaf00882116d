package com.example.qrattendance.roster;

import java.util.Optional;

/**
 * 학생/수업 명단 조회 (외부 협력 컴포넌트)
 */
public interface RosterPort {

    Optional<Student> findStudent(String studentId);

    Optional<AcademyClass> findClass(String classId);
}
