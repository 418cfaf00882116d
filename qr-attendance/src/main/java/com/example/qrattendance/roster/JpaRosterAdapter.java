package com.example.qrattendance.roster;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaRosterAdapter implements RosterPort {

    private final StudentRepository studentRepository;
    private final AcademyClassRepository academyClassRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Student> findStudent(String studentId) {
        return studentRepository.findByIdAndEnabledTrue(studentId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AcademyClass> findClass(String classId) {
        return academyClassRepository.findById(classId);
    }
}
