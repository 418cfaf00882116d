package com.example.qrattendance.service;

import com.example.qrattendance.dto.VerifyResult;
import com.example.qrattendance.entity.AttendanceOutcome;
import com.example.qrattendance.entity.QrToken;
import com.example.qrattendance.entity.QrTokenKey;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.LocalDate;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * SSE 기반 수업별 출석 현황 알림 서비스 (강사 화면용)
 *
 * 프론트엔드 JavaScript 예시:
 * <pre>
 * const es = new EventSource(`/api/attendance/qr/stream/${classId}/${date}`);
 * es.onmessage = (e) => {
 *   const msg = JSON.parse(e.data);
 *   if (msg.type === 'CHECKED_IN') { // 출석 명단 갱신 }
 *   if (msg.type === 'REFRESHED' || msg.type === 'EXPIRED') { // QR 재요청 }
 * };
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttendanceSseNotifier implements LateArrivalNotifier {

    private final ObjectMapper objectMapper;

    // classId:date -> List of SseEmitters
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<SseEmitter>> emitters = new ConcurrentHashMap<>();

    public static String streamKey(String classId, LocalDate date) {
        return new QrTokenKey(classId, date).toString();
    }

    /**
     * SSE 연결 등록
     */
    public void register(String streamKey, SseEmitter emitter) {
        emitters.computeIfAbsent(streamKey, k -> new CopyOnWriteArrayList<>()).add(emitter);

        emitter.onCompletion(() -> removeEmitter(streamKey, emitter));
        emitter.onTimeout(() -> removeEmitter(streamKey, emitter));
        emitter.onError((throwable) -> {
            log.debug("SSE error for stream {}: {}", streamKey, throwable.getMessage());
            removeEmitter(streamKey, emitter);
        });

        log.debug("Registered SSE emitter for stream: {}", streamKey);
    }

    public void notifyCheckedIn(VerifyResult result) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", "CHECKED_IN");
        message.put("studentId", result.getStudentId());
        message.put("studentName", result.getStudentName());
        message.put("status", result.getStatus());
        message.put("checkInTime", String.valueOf(result.getCheckInTime()));
        publish(streamKey(result.getClassId(), result.getDate()), message);
    }

    @Override
    public void notifyLateOrAbsent(AttendanceOutcome outcome) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", "LATE");
        message.put("studentId", outcome.getStudentId());
        message.put("status", outcome.getStatus());
        message.put("checkInTime", String.valueOf(outcome.getCheckInTime()));
        publish(streamKey(outcome.getClassId(), outcome.getDate()), message);
    }

    public void notifyRefreshed(QrToken token) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", "REFRESHED");
        message.put("expiresAt", token.getExpiresAt().toString());
        publish(streamKey(token.getClassId(), token.getDate()), message);
    }

    public void notifyExpired(QrToken token) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", "EXPIRED");
        message.put("expiredAt", token.getExpiresAt().toString());
        publish(streamKey(token.getClassId(), token.getDate()), message);
    }

    /**
     * 하트비트 전송 (15초마다)
     * 연결 유지 및 끊어진 연결 정리
     */
    @Scheduled(fixedRate = 15000)
    public void sendHeartbeat() {
        for (Map.Entry<String, CopyOnWriteArrayList<SseEmitter>> entry : emitters.entrySet()) {
            String streamKey = entry.getKey();
            CopyOnWriteArrayList<SseEmitter> emitterList = entry.getValue();

            Iterator<SseEmitter> iterator = emitterList.iterator();
            while (iterator.hasNext()) {
                SseEmitter emitter = iterator.next();
                try {
                    emitter.send(SseEmitter.event().comment("ping"));
                } catch (IOException e) {
                    log.debug("Heartbeat failed for stream: {}, removing emitter", streamKey);
                    emitterList.remove(emitter);
                    completeQuietly(emitter);
                }
            }

            if (emitterList.isEmpty()) {
                emitters.remove(streamKey, emitterList);
            }
        }
    }

    private void publish(String streamKey, Map<String, Object> message) {
        CopyOnWriteArrayList<SseEmitter> emitterList = emitters.get(streamKey);
        if (emitterList == null || emitterList.isEmpty()) {
            return;
        }

        String jsonData;
        try {
            jsonData = objectMapper.writeValueAsString(message);
        } catch (IOException e) {
            log.error("Failed to serialize {} event for stream: {}", message.get("type"), streamKey, e);
            return;
        }

        for (SseEmitter emitter : emitterList) {
            try {
                emitter.send(SseEmitter.event()
                    .name("message")
                    .data(jsonData));
            } catch (IOException | IllegalStateException e) {
                log.debug("Failed to send {} event to emitter for stream: {}", message.get("type"), streamKey);
                emitterList.remove(emitter);
                try {
                    emitter.completeWithError(e);
                } catch (IllegalStateException alreadyCompleted) {
                    log.trace("Emitter for stream {} already completed", streamKey);
                }
            }
        }
        log.debug("Published {} event to {} subscribers of stream: {}", message.get("type"), emitterList.size(), streamKey);
    }

    private void completeQuietly(SseEmitter emitter) {
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.trace("Emitter already completed: {}", e.getMessage());
        }
    }

    /**
     * 특정 emitter 제거
     */
    private void removeEmitter(String streamKey, SseEmitter emitter) {
        CopyOnWriteArrayList<SseEmitter> emitterList = emitters.get(streamKey);
        if (emitterList != null) {
            emitterList.remove(emitter);
            if (emitterList.isEmpty()) {
                emitters.remove(streamKey, emitterList);
            }
        }
        log.debug("Removed SSE emitter for stream: {}", streamKey);
    }

    /**
     * 현재 등록된 구독자 수 반환 (모니터링용)
     */
    public int getSubscriberCount(String streamKey) {
        CopyOnWriteArrayList<SseEmitter> emitterList = emitters.get(streamKey);
        return emitterList != null ? emitterList.size() : 0;
    }

    /**
     * 전체 활성 연결 수 반환 (모니터링용)
     */
    public int getTotalActiveConnections() {
        return emitters.values().stream().mapToInt(CopyOnWriteArrayList::size).sum();
    }
}
