package com.example.qrattendance.dto;

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
public class QrValidityResponse {
    private String classId;
    private LocalDate date;
    private boolean active;
    private int remainingSeconds;
    private Instant expiresAt;
}
