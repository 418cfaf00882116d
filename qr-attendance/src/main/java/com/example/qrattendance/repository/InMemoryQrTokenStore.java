package com.example.qrattendance.repository;

import com.example.qrattendance.entity.QrToken;
import com.example.qrattendance.entity.QrTokenKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

@Slf4j
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "attendance.qr.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryQrTokenStore implements QrTokenStore {

    private final Clock clock;

    private final ConcurrentHashMap<QrTokenKey, QrToken> tokens = new ConcurrentHashMap<>();

    @Override
    public Optional<QrToken> get(String classId, LocalDate date) {
        QrToken token = tokens.get(new QrTokenKey(classId, date));
        if (token == null || isExpired(token, clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(token);
    }

    @Override
    public void put(String classId, LocalDate date, QrToken token) {
        tokens.put(new QrTokenKey(classId, date), token);
        log.debug("Stored QR token for {}:{} until {}", classId, date, token.getExpiresAt());
    }

    @Override
    public void invalidate(String classId, LocalDate date) {
        QrToken removed = tokens.remove(new QrTokenKey(classId, date));
        if (removed != null) {
            log.debug("Invalidated QR token for {}:{}", classId, date);
        }
    }

    @Override
    public QrToken getOrCreate(String classId, LocalDate date, Supplier<QrToken> tokenSupplier) {
        return tokens.compute(new QrTokenKey(classId, date), (key, existing) -> {
            if (existing != null && !isExpired(existing, clock.instant())) {
                return existing;
            }
            QrToken created = tokenSupplier.get();
            log.debug("Stored QR token for {} until {}", key, created.getExpiresAt());
            return created;
        });
    }

    @Override
    public List<QrToken> evictExpired() {
        Instant now = clock.instant();
        List<QrToken> evicted = new ArrayList<>();
        for (Map.Entry<QrTokenKey, QrToken> entry : tokens.entrySet()) {
            QrToken token = entry.getValue();
            // remove(key, value): a concurrent refresh that already replaced the entry is kept
            if (isExpired(token, now) && tokens.remove(entry.getKey(), token)) {
                evicted.add(token);
            }
        }
        if (!evicted.isEmpty()) {
            log.debug("Evicted {} expired QR tokens", evicted.size());
        }
        return evicted;
    }

    @Override
    public int activeCount() {
        Instant now = clock.instant();
        return (int) tokens.values().stream()
            .filter(token -> !isExpired(token, now))
            .count();
    }

    private boolean isExpired(QrToken token, Instant now) {
        return now.isAfter(token.getExpiresAt());
    }
}
