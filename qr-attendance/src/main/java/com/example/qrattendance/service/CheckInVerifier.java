package com.example.qrattendance.service;

import com.example.qrattendance.attendance.AttendancePort;
import com.example.qrattendance.attendance.InsertResult;
import com.example.qrattendance.dto.VerifyResult;
import com.example.qrattendance.entity.AttendanceOutcome;
import com.example.qrattendance.entity.AttendanceStatus;
import com.example.qrattendance.entity.QrToken;
import com.example.qrattendance.exception.InvalidQrTokenException;
import com.example.qrattendance.exception.UnknownStudentException;
import com.example.qrattendance.repository.QrTokenStore;
import com.example.qrattendance.roster.AcademyClass;
import com.example.qrattendance.roster.RosterPort;
import com.example.qrattendance.roster.Student;
import com.example.qrattendance.util.QrTokenCodec;
import com.example.qrattendance.util.TokenSigner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import static com.example.qrattendance.exception.InvalidQrTokenException.Reason.*;

/**
 * 학생 QR 스캔 검증 및 출석 기록.
 *
 * <ol>
 *   <li>페이로드 파싱 (INVALID_PAYLOAD)</li>
 *   <li>태그 재계산 비교 (TAMPERED_TOKEN)</li>
 *   <li>현재 유효 토큰 조회 (NO_ACTIVE_TOKEN)</li>
 *   <li>nonce 및 식별 필드 비교 (STALE_TOKEN), 체크인 시작 시각 확인 (NOT_YET_OPEN)</li>
 *   <li>학생 조회 (UnknownStudentException)</li>
 *   <li>기존 출석 확인 (ALREADY_CHECKED_IN)</li>
 *   <li>정상/지각 판정</li>
 *   <li>원자적 저장, 저장 시점 중복도 ALREADY_CHECKED_IN 으로 처리</li>
 * </ol>
 * 3단계에서 읽은 토큰 스냅샷을 끝까지 사용하며 중간에 다시 조회하지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckInVerifier {

    private final QrTokenCodec tokenCodec;
    private final TokenSigner tokenSigner;
    private final QrTokenStore tokenStore;
    private final ValidityPolicy validityPolicy;
    private final RosterPort rosterPort;
    private final AttendancePort attendancePort;
    private final LateArrivalNotifier lateArrivalNotifier;
    private final AdapterCalls adapterCalls;
    private final Clock clock;

    public VerifyResult verify(String tokenPayload, String studentId) {
        Instant scannedAt = clock.instant();

        QrToken scanned;
        try {
            scanned = tokenCodec.decode(tokenPayload);
        } catch (InvalidQrTokenException e) {
            log.warn("QR check-in rejected ({}): student={} detail={}", e.getReason(), studentId, e.getMessage());
            throw new InvalidQrTokenException(INVALID_PAYLOAD, "QR 코드 형식이 올바르지 않습니다.", e);
        }

        if (!tokenSigner.verify(tokenCodec.signingInput(scanned), scanned.getTag())) {
            throw rejected(TAMPERED_TOKEN, "QR 코드가 변조되었습니다. 다시 스캔해 주세요.", scanned, studentId);
        }

        QrToken current = tokenStore.get(scanned.getClassId(), scanned.getDate())
            .orElseThrow(() -> rejected(NO_ACTIVE_TOKEN,
                "만료되었거나 유효하지 않은 QR 코드입니다. 새 QR 코드를 요청하세요.", scanned, studentId));

        if (!current.isSameIssuance(scanned)) {
            throw rejected(STALE_TOKEN, "이전 QR 코드입니다. 화면의 최신 QR 코드를 스캔해 주세요.", scanned, studentId);
        }

        if (!validityPolicy.isOpen(current, scannedAt)) {
            throw rejected(NOT_YET_OPEN, String.format("출석 체크는 수업 시작 %d분 전부터 가능합니다.",
                validityPolicy.getOpenBefore().toMinutes()), scanned, studentId);
        }

        Student student = adapterCalls.call("roster.findStudent", () -> rosterPort.findStudent(studentId))
            .orElseThrow(() -> new UnknownStudentException("등록되지 않은 학생입니다: " + studentId));
        String className = adapterCalls.call("roster.findClass", () -> rosterPort.findClass(current.getClassId()))
            .map(AcademyClass::getName)
            .orElse(current.getClassId());

        Optional<AttendanceOutcome> existing = adapterCalls.call("attendance.find",
            () -> attendancePort.findAttendance(studentId, current.getClassId(), current.getDate()));
        if (existing.isPresent()) {
            return alreadyCheckedIn(existing.get(), student, className);
        }

        AttendanceStatus status = validityPolicy.classify(current, scannedAt);
        AttendanceOutcome outcome = AttendanceOutcome.builder()
            .studentId(studentId)
            .classId(current.getClassId())
            .academyId(current.getAcademyId())
            .date(current.getDate())
            .status(status)
            .checkInTime(scannedAt)
            .build();

        InsertResult insertResult = adapterCalls.call("attendance.insert",
            () -> attendancePort.tryInsertAttendance(outcome));
        if (!insertResult.isInserted()) {
            return alreadyCheckedIn(insertResult.getExisting(), student, className);
        }

        log.info("QR check-in recorded: student={} class={} date={} status={}",
            studentId, current.getClassId(), current.getDate(), status);

        if (status == AttendanceStatus.LATE) {
            adapterCalls.fireAndForget("notify.late", () -> lateArrivalNotifier.notifyLateOrAbsent(outcome));
        }

        return VerifyResult.builder()
            .result(VerifyResult.Result.CHECKED_IN)
            .status(status)
            .checkInTime(scannedAt)
            .studentId(studentId)
            .studentName(student.getName())
            .classId(current.getClassId())
            .className(className)
            .date(current.getDate())
            .message(status == AttendanceStatus.ON_TIME ? "출석 체크인이 완료되었습니다." : "지각 체크인이 완료되었습니다.")
            .build();
    }

    private VerifyResult alreadyCheckedIn(AttendanceOutcome existing, Student student, String className) {
        log.info("Duplicate QR check-in ignored: student={} class={} date={} originalTime={}",
            existing.getStudentId(), existing.getClassId(), existing.getDate(), existing.getCheckInTime());
        return VerifyResult.builder()
            .result(VerifyResult.Result.ALREADY_CHECKED_IN)
            .status(existing.getStatus())
            .checkInTime(existing.getCheckInTime())
            .studentId(existing.getStudentId())
            .studentName(student.getName())
            .classId(existing.getClassId())
            .className(className)
            .date(existing.getDate())
            .message("이미 출석 체크가 완료되었습니다.")
            .build();
    }

    private InvalidQrTokenException rejected(InvalidQrTokenException.Reason reason, String message,
                                             QrToken scanned, String studentId) {
        log.warn("QR check-in rejected ({}): student={} class={} date={}",
            reason, studentId, scanned.getClassId(), scanned.getDate());
        return new InvalidQrTokenException(reason, message);
    }
}
