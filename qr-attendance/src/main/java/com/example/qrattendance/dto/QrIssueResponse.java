package com.example.qrattendance.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
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
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QrIssueResponse {
    private String qrData;
    private String classId;
    private LocalDate date;
    private Instant expiresAt;
    private int remainingSeconds;
    private QrValidityInfo validity;
    private String dataUrl;
}
