package com.example.qrattendance.service;

import com.example.qrattendance.dto.QrIssueResponse;
import com.example.qrattendance.dto.QrValidityResponse;
import com.example.qrattendance.dto.VerifyResult;
import com.example.qrattendance.entity.QrToken;
import com.example.qrattendance.repository.QrTokenStore;
import com.example.qrattendance.roster.AcademyClass;
import com.example.qrattendance.roster.RosterPort;
import com.example.qrattendance.util.QrTokenCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;

/**
 * QR 출석 API 진입점: 강사용 QR 발급/갱신, 학생용 체크인, 유효시간 조회.
 */
@Slf4j
@Service
public class QrAttendanceService {

    private final QrTokenIssuer tokenIssuer;
    private final CheckInVerifier checkInVerifier;
    private final QrTokenStore tokenStore;
    private final QrTokenCodec tokenCodec;
    private final ValidityPolicy validityPolicy;
    private final RosterPort rosterPort;
    private final AdapterCalls adapterCalls;
    private final AttendanceSseNotifier attendanceSseNotifier;
    private final Clock clock;
    private final LocalTime defaultClassStart;
    private final String defaultAcademyId;

    public QrAttendanceService(QrTokenIssuer tokenIssuer,
                               CheckInVerifier checkInVerifier,
                               QrTokenStore tokenStore,
                               QrTokenCodec tokenCodec,
                               ValidityPolicy validityPolicy,
                               RosterPort rosterPort,
                               AdapterCalls adapterCalls,
                               AttendanceSseNotifier attendanceSseNotifier,
                               Clock clock,
                               @Value("${attendance.qr.default-class-start:14:00}") String defaultClassStart,
                               @Value("${attendance.qr.default-academy-id:academy-001}") String defaultAcademyId) {
        this.tokenIssuer = tokenIssuer;
        this.checkInVerifier = checkInVerifier;
        this.tokenStore = tokenStore;
        this.tokenCodec = tokenCodec;
        this.validityPolicy = validityPolicy;
        this.rosterPort = rosterPort;
        this.adapterCalls = adapterCalls;
        this.attendanceSseNotifier = attendanceSseNotifier;
        this.clock = clock;
        this.defaultClassStart = LocalTime.parse(defaultClassStart, QrTokenCodec.START_TIME_FORMAT);
        this.defaultAcademyId = defaultAcademyId;
    }

    /**
     * QR 토큰 발급. forceRefresh 가 true 이면 기존 토큰을 무효화하고 새로 발급한다.
     * date, classStartTime, academyId 가 없으면 오늘 날짜, 수업 정규 시작 시간, 기본 학원으로 채운다.
     */
    public QrToken issueToken(String classId, LocalDate date, LocalTime classStartTime,
                              String academyId, boolean forceRefresh) {
        if (!StringUtils.hasText(classId)) {
            throw new IllegalArgumentException("class_id is required");
        }
        LocalDate lessonDate = date != null ? date : today();
        String academy = StringUtils.hasText(academyId) ? academyId : defaultAcademyId;

        if (forceRefresh) {
            LocalTime startTime = classStartTime != null ? classStartTime : scheduledStart(classId);
            QrToken token = tokenIssuer.refresh(classId, lessonDate, startTime, academy);
            adapterCalls.fireAndForget("notify.refreshed", () -> attendanceSseNotifier.notifyRefreshed(token));
            return token;
        }

        if (classStartTime == null) {
            Optional<QrToken> live = tokenStore.get(classId, lessonDate);
            if (live.isPresent()) {
                return live.get();
            }
        }
        LocalTime startTime = classStartTime != null ? classStartTime : scheduledStart(classId);
        return tokenIssuer.issue(classId, lessonDate, startTime, academy);
    }

    public QrIssueResponse toIssueResponse(QrToken token) {
        return QrIssueResponse.builder()
            .qrData(tokenCodec.encode(token))
            .classId(token.getClassId())
            .date(token.getDate())
            .expiresAt(token.getExpiresAt())
            .remainingSeconds(validityPolicy.remainingSeconds(token, clock.instant()))
            .validity(validityPolicy.validityInfo())
            .build();
    }

    public VerifyResult verifyScan(String tokenPayload, String studentId) {
        VerifyResult result = checkInVerifier.verify(tokenPayload, studentId);
        if (result.isCheckedIn()) {
            adapterCalls.fireAndForget("notify.checked-in", () -> attendanceSseNotifier.notifyCheckedIn(result));
        }
        return result;
    }

    public QrValidityResponse getValidity(String classId, LocalDate date) {
        LocalDate lessonDate = date != null ? date : today();
        Instant now = clock.instant();
        return tokenStore.get(classId, lessonDate)
            .map(token -> QrValidityResponse.builder()
                .classId(classId)
                .date(lessonDate)
                .active(true)
                .remainingSeconds(validityPolicy.remainingSeconds(token, now))
                .expiresAt(token.getExpiresAt())
                .build())
            .orElseGet(() -> QrValidityResponse.builder()
                .classId(classId)
                .date(lessonDate)
                .active(false)
                .remainingSeconds(0)
                .build());
    }

    public LocalDate today() {
        return LocalDate.now(clock.withZone(validityPolicy.getZoneId()));
    }

    private LocalTime scheduledStart(String classId) {
        return adapterCalls.call("roster.findClass", () -> rosterPort.findClass(classId))
            .map(AcademyClass::getStartTime)
            .orElseGet(() -> {
                log.debug("No scheduled start time for class {}, using default {}", classId, defaultClassStart);
                return defaultClassStart;
            });
    }
}
