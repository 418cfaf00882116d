package com.example.qrattendance.controller;

import com.example.qrattendance.service.AttendanceSseNotifier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 강사 화면용 출석 현황 SSE 스트림
 *
 * GET /api/attendance/qr/stream/{classId}/{date}
 * - checked-in, late, qr-refreshed, qr-expired 이벤트 수신
 * - 타임아웃: 120초
 */
@Slf4j
@RestController
@RequestMapping("/api/attendance/qr")
@RequiredArgsConstructor
@Tag(name = "QR 출석 스트림", description = "출석 현황 실시간 알림")
public class QrAttendanceSseController {

    static final long RATE_LIMIT_WINDOW_MS = 60_000;
    static final int MAX_CONNECTIONS_PER_IP = 10;
    private static final long EMITTER_TIMEOUT_MS = 120_000L;

    private final AttendanceSseNotifier attendanceSseNotifier;

    // IP별 고정 윈도우 연결 카운터
    private final ConcurrentHashMap<String, ConnectionWindow> rateLimitMap = new ConcurrentHashMap<>();

    @Operation(summary = "출석 현황 스트림 구독")
    @GetMapping(value = "/stream/{classId}/{date}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamAttendance(@PathVariable String classId,
                                       @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
                                       HttpServletRequest request) {
        String clientIp = getClientIp(request);
        String streamKey = AttendanceSseNotifier.streamKey(classId, date);

        if (!isRateLimitAllowed(clientIp)) {
            log.warn("Rate limit exceeded for IP: {} on stream: {}", clientIp, streamKey);
            SseEmitter rejected = new SseEmitter(0L);
            rejected.completeWithError(new IllegalStateException("Too many connections"));
            return rejected;
        }

        SseEmitter emitter = new SseEmitter(EMITTER_TIMEOUT_MS);
        try {
            emitter.send(SseEmitter.event()
                .name("connected")
                .data(Map.of("status", "connected", "classId", classId, "date", date.toString())));
        } catch (IOException e) {
            log.error("Failed to send initial connection message for stream: {}", streamKey, e);
            emitter.completeWithError(e);
            return emitter;
        }

        attendanceSseNotifier.register(streamKey, emitter);
        log.info("SSE connection established for stream: {} from IP: {}", streamKey, clientIp);
        return emitter;
    }

    @Operation(summary = "스트림 연결 현황 (모니터링)")
    @GetMapping("/stream/stats/{classId}/{date}")
    public Map<String, Object> getStreamStats(@PathVariable String classId,
                                              @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        String streamKey = AttendanceSseNotifier.streamKey(classId, date);
        return Map.of(
            "stream", streamKey,
            "subscriberCount", attendanceSseNotifier.getSubscriberCount(streamKey),
            "totalActiveConnections", attendanceSseNotifier.getTotalActiveConnections()
        );
    }

    private String getClientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }

        String xRealIp = request.getHeader("X-Real-IP");
        if (xRealIp != null && !xRealIp.isEmpty()) {
            return xRealIp;
        }

        return request.getRemoteAddr();
    }

    // TODO: 다중 인스턴스 배포 시 Redis INCR + EXPIRE 기반 카운터로 교체
    private boolean isRateLimitAllowed(String clientIp) {
        long now = System.currentTimeMillis();
        ConnectionWindow window = rateLimitMap.compute(clientIp, (ip, current) -> {
            if (current == null || now - current.startedAt > RATE_LIMIT_WINDOW_MS) {
                return new ConnectionWindow(now, 1);
            }
            return new ConnectionWindow(current.startedAt, current.count + 1);
        });
        return window.count <= MAX_CONNECTIONS_PER_IP;
    }

    @Scheduled(fixedRate = RATE_LIMIT_WINDOW_MS)
    public void evictStaleWindows() {
        evictStaleWindows(System.currentTimeMillis());
    }

    void evictStaleWindows(long now) {
        int before = rateLimitMap.size();
        rateLimitMap.entrySet().removeIf(entry -> now - entry.getValue().startedAt > RATE_LIMIT_WINDOW_MS);
        int evicted = before - rateLimitMap.size();
        if (evicted > 0) {
            log.debug("Evicted {} stale connection windows", evicted);
        }
    }

    int trackedClientCount() {
        return rateLimitMap.size();
    }

    private static final class ConnectionWindow {
        private final long startedAt;
        private final int count;

        private ConnectionWindow(long startedAt, int count) {
            this.startedAt = startedAt;
            this.count = count;
        }
    }
}
