package com.example.qrattendance.controller;

import com.example.qrattendance.dto.QrCheckInRequest;
import com.example.qrattendance.dto.QrIssueResponse;
import com.example.qrattendance.dto.QrValidityResponse;
import com.example.qrattendance.dto.VerifyResult;
import com.example.qrattendance.entity.QrToken;
import com.example.qrattendance.service.QrAttendanceService;
import com.example.qrattendance.util.QrGenerator;
import com.example.qrattendance.util.QrTokenCodec;
import com.google.zxing.WriterException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

@Slf4j
@RestController
@RequestMapping("/api/attendance/qr")
@RequiredArgsConstructor
@Tag(name = "QR 출석", description = "QR 코드 기반 출석 체크인 API")
public class QrAttendanceController {

    private static final Pattern DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern TIME_PATTERN = Pattern.compile("^\\d{2}:\\d{2}$");

    private final QrAttendanceService qrAttendanceService;
    private final QrGenerator qrGenerator;

    @Operation(summary = "QR 코드 생성 (강사용)",
        description = "수업/날짜별 출석 QR 을 발급합니다. 유효한 QR 이 있으면 재사용하고, refresh=true 이면 기존 QR 을 무효화 후 새로 생성합니다.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "QR 발급 성공",
            content = {
                @Content(mediaType = "application/json", schema = @Schema(implementation = QrIssueResponse.class)),
                @Content(mediaType = "image/png")
            }),
        @ApiResponse(responseCode = "400", description = "잘못된 파라미터")
    })
    @GetMapping
    public ResponseEntity<?> issueQr(
            @Parameter(description = "수업 ID", required = true) @RequestParam("class_id") String classId,
            @Parameter(description = "날짜 YYYY-MM-DD, 기본값 오늘") @RequestParam(value = "date", required = false) String date,
            @Parameter(description = "수업 시작 시간 HH:mm") @RequestParam(value = "class_start_time", required = false) String classStartTime,
            @Parameter(description = "학원 ID") @RequestParam(value = "academy_id", required = false) String academyId,
            @Parameter(description = "json | image | dataurl") @RequestParam(value = "format", defaultValue = "json") String format,
            @Parameter(description = "기존 QR 무효화 후 재발급") @RequestParam(value = "refresh", defaultValue = "false") boolean refresh) {

        QrToken token = qrAttendanceService.issueToken(classId, parseDate(date), parseTime(classStartTime), academyId, refresh);
        QrIssueResponse response = qrAttendanceService.toIssueResponse(token);

        try {
            switch (format) {
                case "image":
                    HttpHeaders headers = new HttpHeaders();
                    headers.setContentType(MediaType.IMAGE_PNG);
                    headers.setCacheControl("no-store");
                    headers.add("X-QR-Expires-At", response.getExpiresAt().toString());
                    return ResponseEntity.ok()
                        .headers(headers)
                        .body(qrGenerator.generateQRCodeImage(response.getQrData()));
                case "dataurl":
                    response.setDataUrl(qrGenerator.generateQRCodeDataUrl(response.getQrData()));
                    return ResponseEntity.ok(response);
                case "json":
                    return ResponseEntity.ok(response);
                default:
                    throw new IllegalArgumentException("format 은 json, image, dataurl 중 하나여야 합니다.");
            }
        } catch (WriterException | IOException e) {
            log.error("Failed to render QR image for class: {}", classId, e);
            throw new IllegalStateException("Failed to generate QR code", e);
        }
    }

    @Operation(summary = "QR 체크인 (학생용)", description = "스캔한 QR 데이터로 출석 체크인을 처리합니다.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "체크인 완료 또는 이미 출석 처리됨",
            content = @Content(schema = @Schema(implementation = VerifyResult.class))),
        @ApiResponse(responseCode = "400", description = "유효하지 않은 QR (변조, 만료, 이전 QR 등)"),
        @ApiResponse(responseCode = "404", description = "등록되지 않은 학생"),
        @ApiResponse(responseCode = "503", description = "일시적 오류, 재시도 가능")
    })
    @PostMapping
    public ResponseEntity<VerifyResult> checkIn(@Valid @RequestBody QrCheckInRequest request) {
        VerifyResult result = qrAttendanceService.verifyScan(request.getQrData(), request.getStudentId());
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "QR 유효시간 조회", description = "현재 QR 의 남은 유효시간(초)을 반환합니다.")
    @GetMapping("/validity")
    public ResponseEntity<QrValidityResponse> getValidity(
            @RequestParam("class_id") String classId,
            @RequestParam(value = "date", required = false) String date) {
        return ResponseEntity.ok(qrAttendanceService.getValidity(classId, parseDate(date)));
    }

    private LocalDate parseDate(String date) {
        if (date == null || date.isBlank()) {
            return null;
        }
        if (!DATE_PATTERN.matcher(date).matches()) {
            throw new IllegalArgumentException("날짜 형식이 올바르지 않습니다. (YYYY-MM-DD)");
        }
        try {
            return LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("날짜 형식이 올바르지 않습니다. (YYYY-MM-DD)");
        }
    }

    private LocalTime parseTime(String time) {
        if (time == null || time.isBlank()) {
            return null;
        }
        if (!TIME_PATTERN.matcher(time).matches()) {
            throw new IllegalArgumentException("시간 형식이 올바르지 않습니다. (HH:mm)");
        }
        try {
            return LocalTime.parse(time, QrTokenCodec.START_TIME_FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("시간 형식이 올바르지 않습니다. (HH:mm)");
        }
    }
}
