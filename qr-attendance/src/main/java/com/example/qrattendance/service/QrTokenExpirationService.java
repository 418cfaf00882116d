package com.example.qrattendance.service;

import com.example.qrattendance.entity.QrToken;
import com.example.qrattendance.repository.QrTokenStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 만료된 QR 토큰 정리 및 SSE 만료 알림.
 * 조회 시점의 지연 만료만으로도 정합성은 보장되며, 이 작업은 메모리 정리와 화면 갱신용이다.
 * Redis 저장소는 키 TTL 로 자체 만료되므로 정리 대상이 없다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QrTokenExpirationService {

    private final QrTokenStore tokenStore;
    private final AttendanceSseNotifier attendanceSseNotifier;

    @Scheduled(fixedRateString = "${attendance.qr.sweep-interval-ms:30000}")
    public void evictExpiredTokens() {
        List<QrToken> expired = tokenStore.evictExpired();
        for (QrToken token : expired) {
            attendanceSseNotifier.notifyExpired(token);
        }
        if (!expired.isEmpty()) {
            log.info("Evicted {} expired QR tokens, {} still active", expired.size(), tokenStore.activeCount());
        }
    }
}
