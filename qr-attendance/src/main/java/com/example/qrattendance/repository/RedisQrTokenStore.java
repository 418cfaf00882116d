package com.example.qrattendance.repository;

import com.example.qrattendance.entity.QrToken;
import com.example.qrattendance.exception.InvalidQrTokenException;
import com.example.qrattendance.util.QrTokenCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis 기반 QR 토큰 저장소. 키마다 서명된 토큰 페이로드를 남은 수명만큼의 TTL 로 저장한다.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "attendance.qr.store", havingValue = "redis")
public class RedisQrTokenStore implements QrTokenStore {

    private static final String KEY_PREFIX = "qr:attendance:";
    private static final String ACTIVE_PATTERN = KEY_PREFIX + "*";
    private static final int MAX_CREATE_ATTEMPTS = 3;

    private final StringRedisTemplate redisTemplate;
    private final QrTokenCodec tokenCodec;
    private final Clock clock;

    @Override
    public Optional<QrToken> get(String classId, LocalDate date) {
        String payload = redisTemplate.opsForValue().get(key(classId, date));
        if (payload == null) {
            return Optional.empty();
        }
        QrToken token;
        try {
            token = tokenCodec.decode(payload);
        } catch (InvalidQrTokenException e) {
            log.error("Corrupted QR token stored under {}, discarding", key(classId, date), e);
            redisTemplate.delete(key(classId, date));
            return Optional.empty();
        }
        if (clock.instant().isAfter(token.getExpiresAt())) {
            return Optional.empty();
        }
        return Optional.of(token);
    }

    @Override
    public void put(String classId, LocalDate date, QrToken token) {
        Duration ttl = ttl(token);
        if (ttl.isZero()) {
            invalidate(classId, date);
            return;
        }
        redisTemplate.opsForValue().set(key(classId, date), tokenCodec.encode(token), ttl);
        log.debug("Saved QR token {} for {} ms", key(classId, date), ttl.toMillis());
    }

    @Override
    public void invalidate(String classId, LocalDate date) {
        redisTemplate.delete(key(classId, date));
        log.debug("Deleted QR token {}", key(classId, date));
    }

    @Override
    public QrToken getOrCreate(String classId, LocalDate date, Supplier<QrToken> tokenSupplier) {
        String key = key(classId, date);
        for (int attempt = 0; attempt < MAX_CREATE_ATTEMPTS; attempt++) {
            Optional<QrToken> existing = get(classId, date);
            if (existing.isPresent()) {
                return existing.get();
            }
            QrToken created = tokenSupplier.get();
            Boolean stored = redisTemplate.opsForValue().setIfAbsent(key, tokenCodec.encode(created), ttl(created));
            if (Boolean.TRUE.equals(stored)) {
                log.debug("Saved QR token {} for {} ms", key, ttl(created).toMillis());
                return created;
            }
        }
        throw new IllegalStateException("Could not install QR token for " + key + " after concurrent updates");
    }

    /**
     * Redis 키 TTL 로 자동 만료되므로 정리할 항목이 없다.
     */
    @Override
    public List<QrToken> evictExpired() {
        return List.of();
    }

    @Override
    public int activeCount() {
        Set<String> keys = redisTemplate.keys(ACTIVE_PATTERN);
        return keys != null ? keys.size() : 0;
    }

    private Duration ttl(QrToken token) {
        Duration remaining = Duration.between(clock.instant(), token.getExpiresAt());
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private String key(String classId, LocalDate date) {
        return KEY_PREFIX + classId + ":" + date;
    }
}
