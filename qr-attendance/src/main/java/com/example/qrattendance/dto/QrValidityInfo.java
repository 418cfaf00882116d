package com.example.qrattendance.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QrValidityInfo {
    private long validityWindowSeconds;
    private long gracePeriodMinutes;
    private long openBeforeMinutes;
    private String zoneId;
}
