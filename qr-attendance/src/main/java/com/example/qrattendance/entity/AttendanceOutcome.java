package com.example.qrattendance.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;

@Value
@Builder
public class AttendanceOutcome {

    String studentId;
    String classId;
    String academyId;
    LocalDate date;
    AttendanceStatus status;
    Instant checkInTime;
}
