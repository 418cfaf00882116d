package com.example.qrattendance.dto;

import com.example.qrattendance.entity.AttendanceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerifyResult {

    private Result result;
    private AttendanceStatus status;
    /** ALREADY_CHECKED_IN 인 경우 최초 체크인 시각 */
    private Instant checkInTime;
    private String studentId;
    private String studentName;
    private String classId;
    private String className;
    private LocalDate date;
    private String message;

    public boolean isCheckedIn() {
        return result == Result.CHECKED_IN;
    }

    public enum Result {
        CHECKED_IN,
        ALREADY_CHECKED_IN
    }
}
