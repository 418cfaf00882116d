package com.example.qrattendance.service;

import com.example.qrattendance.entity.QrToken;
import com.example.qrattendance.repository.QrTokenStore;
import com.example.qrattendance.util.QrTokenCodec;
import com.example.qrattendance.util.TokenSigner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.Base64;

/**
 * 수업/날짜별 QR 토큰 발급 및 갱신.
 * 키마다 유효한 토큰은 항상 하나뿐이다.
 */
@Slf4j
@Service
public class QrTokenIssuer {

    private static final int NONCE_BYTES = 16;

    private final QrTokenStore tokenStore;
    private final TokenSigner tokenSigner;
    private final QrTokenCodec tokenCodec;
    private final ValidityPolicy validityPolicy;
    private final Clock clock;
    private final SecureRandom secureRandom;

    public QrTokenIssuer(QrTokenStore tokenStore,
                         TokenSigner tokenSigner,
                         QrTokenCodec tokenCodec,
                         ValidityPolicy validityPolicy,
                         Clock clock) {
        this.tokenStore = tokenStore;
        this.tokenSigner = tokenSigner;
        this.tokenCodec = tokenCodec;
        this.validityPolicy = validityPolicy;
        this.clock = clock;
        this.secureRandom = new SecureRandom();
        // clock or entropy source failures abort startup instead of surfacing per request
        try {
            clock.instant();
            secureRandom.nextBytes(new byte[NONCE_BYTES]);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Clock or random source is unavailable", e);
        }
    }

    /**
     * 유효한 토큰이 있으면 그대로 재사용하고, 없으면 새로 발급한다.
     */
    public QrToken issue(String classId, LocalDate date, LocalTime classStartTime, String academyId) {
        QrToken token = tokenStore.getOrCreate(classId, date,
            () -> newToken(classId, date, classStartTime, academyId));
        log.debug("QR token for {}:{} valid until {}", classId, date, token.getExpiresAt());
        return token;
    }

    /**
     * 기존 토큰을 즉시 무효화하고 새 토큰을 발급한다. 유출된 QR 사본은 모두 STALE 처리된다.
     */
    public QrToken refresh(String classId, LocalDate date, LocalTime classStartTime, String academyId) {
        tokenStore.invalidate(classId, date);
        QrToken token = newToken(classId, date, classStartTime, academyId);
        tokenStore.put(classId, date, token);
        log.info("QR token refreshed for class: {} date: {}", classId, date);
        return token;
    }

    private QrToken newToken(String classId, LocalDate date, LocalTime classStartTime, String academyId) {
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        QrToken unsigned = QrToken.builder()
            .academyId(academyId)
            .classId(classId)
            .date(date)
            .classStartTime(classStartTime.truncatedTo(ChronoUnit.MINUTES))
            .issuedAt(issuedAt)
            .expiresAt(validityPolicy.expiresAt(issuedAt))
            .nonce(generateNonce())
            .build();

        QrToken token = unsigned.toBuilder()
            .tag(tokenSigner.sign(tokenCodec.signingInput(unsigned)))
            .build();

        log.info("QR token issued for class: {} date: {} expiresAt: {}", classId, date, token.getExpiresAt());
        return token;
    }

    private String generateNonce() {
        byte[] bytes = new byte[NONCE_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
