package com.example.qrattendance.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 한 수업(classId, date)의 출석 체크인 창을 나타내는 QR 토큰.
 * 갱신(refresh) 시 새 토큰으로 대체될 뿐 기존 인스턴스는 변경되지 않는다.
 */
@Value
@Builder(toBuilder = true)
public class QrToken {

    String academyId;
    String classId;
    LocalDate date;
    LocalTime classStartTime;
    Instant issuedAt;
    Instant expiresAt;
    String nonce;
    String tag;

    public QrTokenKey key() {
        return new QrTokenKey(classId, date);
    }

    /**
     * Same issuance: every signed field matches, so a payload carrying an older
     * nonce for the same class/date is not accepted against the current token.
     */
    public boolean isSameIssuance(QrToken other) {
        return other != null
            && nonce.equals(other.nonce)
            && classId.equals(other.classId)
            && date.equals(other.date)
            && academyId.equals(other.academyId)
            && classStartTime.equals(other.classStartTime)
            && issuedAt.equals(other.issuedAt)
            && expiresAt.equals(other.expiresAt);
    }
}
