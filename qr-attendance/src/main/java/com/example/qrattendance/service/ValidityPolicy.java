package com.example.qrattendance.service;

import com.example.qrattendance.dto.QrValidityInfo;
import com.example.qrattendance.entity.AttendanceStatus;
import com.example.qrattendance.entity.QrToken;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * QR 토큰 유효시간 및 지각 판정 규칙.
 *
 * <ul>
 *   <li>토큰 수명: 발급 시각 + validityWindow, {@code now > expiresAt} 이면 만료</li>
 *   <li>지각 기준: 수업 시작 + gracePeriod 까지(포함) 정상 출석, 그 이후 지각</li>
 *   <li>체크인 시작: 수업 시작 openBefore 전부터</li>
 * </ul>
 * 지각 판정은 토큰 만료와 독립적이다. 유효한 토큰으로도 지각 처리될 수 있다.
 */
@Getter
@Component
public class ValidityPolicy {

    private final Duration validityWindow;
    private final Duration gracePeriod;
    private final Duration openBefore;
    private final ZoneId zoneId;

    public ValidityPolicy(@Value("${attendance.qr.validity-window:PT2M}") Duration validityWindow,
                          @Value("${attendance.qr.grace-period:PT10M}") Duration gracePeriod,
                          @Value("${attendance.qr.open-before:PT30M}") Duration openBefore,
                          @Value("${attendance.qr.zone-id:Asia/Seoul}") ZoneId zoneId) {
        if (validityWindow.isNegative() || validityWindow.isZero()) {
            throw new IllegalArgumentException("attendance.qr.validity-window must be positive");
        }
        if (gracePeriod.isNegative() || openBefore.isNegative()) {
            throw new IllegalArgumentException("grace-period and open-before must not be negative");
        }
        this.validityWindow = validityWindow;
        this.gracePeriod = gracePeriod;
        this.openBefore = openBefore;
        this.zoneId = zoneId;
    }

    public Instant expiresAt(Instant issuedAt) {
        return issuedAt.plus(validityWindow);
    }

    public int remainingSeconds(QrToken token, Instant now) {
        long seconds = Duration.between(now, token.getExpiresAt()).getSeconds();
        return (int) Math.max(0, seconds);
    }

    public boolean isExpired(QrToken token, Instant now) {
        return now.isAfter(token.getExpiresAt());
    }

    public AttendanceStatus classify(QrToken token, Instant scannedAt) {
        Instant lateAfter = classStart(token).plus(gracePeriod);
        return scannedAt.isAfter(lateAfter) ? AttendanceStatus.LATE : AttendanceStatus.ON_TIME;
    }

    public Instant opensAt(QrToken token) {
        return classStart(token).minus(openBefore);
    }

    public boolean isOpen(QrToken token, Instant scannedAt) {
        return !scannedAt.isBefore(opensAt(token));
    }

    public Instant classStart(QrToken token) {
        return ZonedDateTime.of(token.getDate(), token.getClassStartTime(), zoneId).toInstant();
    }

    public QrValidityInfo validityInfo() {
        return QrValidityInfo.builder()
            .validityWindowSeconds(validityWindow.getSeconds())
            .gracePeriodMinutes(gracePeriod.toMinutes())
            .openBeforeMinutes(openBefore.toMinutes())
            .zoneId(zoneId.getId())
            .build();
    }
}
