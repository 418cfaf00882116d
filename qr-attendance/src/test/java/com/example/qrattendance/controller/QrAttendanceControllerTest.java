package com.example.qrattendance.controller;

import com.example.qrattendance.dto.QrIssueResponse;
import com.example.qrattendance.dto.QrValidityInfo;
import com.example.qrattendance.dto.QrValidityResponse;
import com.example.qrattendance.dto.VerifyResult;
import com.example.qrattendance.entity.AttendanceStatus;
import com.example.qrattendance.entity.QrToken;
import com.example.qrattendance.exception.AdapterTimeoutException;
import com.example.qrattendance.exception.InvalidQrTokenException;
import com.example.qrattendance.exception.UnknownStudentException;
import com.example.qrattendance.service.QrAttendanceService;
import com.example.qrattendance.util.QrGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(QrAttendanceController.class)
class QrAttendanceControllerTest {

    private static final LocalDate DATE = LocalDate.of(2025, 1, 20);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private QrAttendanceService qrAttendanceService;

    @MockBean
    private QrGenerator qrGenerator;

    private QrToken token;

    @BeforeEach
    void setUp() {
        token = QrToken.builder()
            .academyId("academy-001")
            .classId("C1")
            .date(DATE)
            .classStartTime(LocalTime.of(14, 0))
            .issuedAt(Instant.parse("2025-01-20T04:55:00Z"))
            .expiresAt(Instant.parse("2025-01-20T04:57:00Z"))
            .nonce("n")
            .tag("t")
            .build();
        when(qrAttendanceService.issueToken(anyString(), any(), any(), any(), anyBoolean())).thenReturn(token);
        when(qrAttendanceService.toIssueResponse(token)).thenAnswer(invocation -> QrIssueResponse.builder()
            .qrData("{\"classId\":\"C1\"}")
            .classId("C1")
            .date(DATE)
            .expiresAt(token.getExpiresAt())
            .remainingSeconds(120)
            .validity(new QrValidityInfo(120, 10, 30, "Asia/Seoul"))
            .build());
    }

    @Test
    void testIssueQrAsJson() throws Exception {
        mockMvc.perform(get("/api/attendance/qr")
                .param("class_id", "C1")
                .param("date", "2025-01-20")
                .param("class_start_time", "14:00"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
            .andExpect(jsonPath("$.qrData").value("{\"classId\":\"C1\"}"))
            .andExpect(jsonPath("$.remainingSeconds").value(120))
            .andExpect(jsonPath("$.validity.gracePeriodMinutes").value(10))
            .andExpect(jsonPath("$.dataUrl").doesNotExist());

        verify(qrAttendanceService).issueToken("C1", DATE, LocalTime.of(14, 0), null, false);
    }

    @Test
    void testIssueQrWithRefresh() throws Exception {
        mockMvc.perform(get("/api/attendance/qr")
                .param("class_id", "C1")
                .param("refresh", "true"))
            .andExpect(status().isOk());

        verify(qrAttendanceService).issueToken(eq("C1"), isNull(), isNull(), isNull(), eq(true));
    }

    @Test
    void testIssueQrAsImage() throws Exception {
        byte[] png = new byte[]{(byte) 0x89, 'P', 'N', 'G'};
        when(qrGenerator.generateQRCodeImage("{\"classId\":\"C1\"}")).thenReturn(png);

        mockMvc.perform(get("/api/attendance/qr")
                .param("class_id", "C1")
                .param("format", "image"))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.IMAGE_PNG))
            .andExpect(header().string("Cache-Control", "no-store"))
            .andExpect(header().string("X-QR-Expires-At", "2025-01-20T04:57:00Z"))
            .andExpect(content().bytes(png));
    }

    @Test
    void testIssueQrAsDataUrl() throws Exception {
        when(qrGenerator.generateQRCodeDataUrl(anyString())).thenReturn("data:image/png;base64,AAAA");

        mockMvc.perform(get("/api/attendance/qr")
                .param("class_id", "C1")
                .param("format", "dataurl"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.dataUrl").value("data:image/png;base64,AAAA"));
    }

    @Test
    void testIssueQrRejectsBadParameters() throws Exception {
        mockMvc.perform(get("/api/attendance/qr"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("class_id is required"));

        mockMvc.perform(get("/api/attendance/qr").param("class_id", "C1").param("date", "20250120"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/attendance/qr").param("class_id", "C1").param("date", "2025-02-30"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/attendance/qr").param("class_id", "C1").param("class_start_time", "2pm"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/attendance/qr").param("class_id", "C1").param("format", "svg"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testCheckIn() throws Exception {
        when(qrAttendanceService.verifyScan("payload", "S1")).thenReturn(VerifyResult.builder()
            .result(VerifyResult.Result.CHECKED_IN)
            .status(AttendanceStatus.ON_TIME)
            .checkInTime(Instant.parse("2025-01-20T04:56:00Z"))
            .studentId("S1")
            .studentName("김학생")
            .classId("C1")
            .className("수학 A반")
            .date(DATE)
            .message("출석 체크인이 완료되었습니다.")
            .build());

        mockMvc.perform(post("/api/attendance/qr")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"qrData\":\"payload\",\"studentId\":\"S1\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result").value("CHECKED_IN"))
            .andExpect(jsonPath("$.status").value("ON_TIME"))
            .andExpect(jsonPath("$.checkInTime").value("2025-01-20T04:56:00Z"))
            .andExpect(jsonPath("$.date").value("2025-01-20"));
    }

    @Test
    void testCheckInAcceptsSnakeCaseFields() throws Exception {
        when(qrAttendanceService.verifyScan("payload", "S1")).thenReturn(VerifyResult.builder()
            .result(VerifyResult.Result.ALREADY_CHECKED_IN)
            .status(AttendanceStatus.LATE)
            .studentId("S1")
            .build());

        mockMvc.perform(post("/api/attendance/qr")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"qr_data\":\"payload\",\"student_id\":\"S1\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.result").value("ALREADY_CHECKED_IN"));
    }

    @Test
    void testCheckInValidation() throws Exception {
        mockMvc.perform(post("/api/attendance/qr")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"qrData\":\"payload\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.fields.studentId").exists());

        mockMvc.perform(post("/api/attendance/qr")
                .contentType(MediaType.APPLICATION_JSON)
                .content("not json"))
            .andExpect(status().isBadRequest());

        verify(qrAttendanceService, never()).verifyScan(anyString(), anyString());
    }

    @Test
    void testCheckInRejectedToken() throws Exception {
        when(qrAttendanceService.verifyScan("old", "S1")).thenThrow(new InvalidQrTokenException(
            InvalidQrTokenException.Reason.STALE_TOKEN, "이전 QR 코드입니다."));

        mockMvc.perform(post("/api/attendance/qr")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"qrData\":\"old\",\"studentId\":\"S1\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid QR Token"))
            .andExpect(jsonPath("$.reason").value("STALE_TOKEN"));
    }

    @Test
    void testCheckInUnknownStudent() throws Exception {
        when(qrAttendanceService.verifyScan("payload", "ghost"))
            .thenThrow(new UnknownStudentException("등록되지 않은 학생입니다: ghost"));

        mockMvc.perform(post("/api/attendance/qr")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"qrData\":\"payload\",\"studentId\":\"ghost\"}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Unknown Student"));
    }

    @Test
    void testCheckInAdapterTimeoutIsRetryable() throws Exception {
        when(qrAttendanceService.verifyScan("payload", "S1"))
            .thenThrow(new AdapterTimeoutException("attendance.insert", Duration.ofSeconds(3), null));

        mockMvc.perform(post("/api/attendance/qr")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"qrData\":\"payload\",\"studentId\":\"S1\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.retryable").value(true))
            .andExpect(jsonPath("$.operation").value("attendance.insert"));
    }

    @Test
    void testValidity() throws Exception {
        when(qrAttendanceService.getValidity("C1", DATE)).thenReturn(QrValidityResponse.builder()
            .classId("C1")
            .date(DATE)
            .active(true)
            .remainingSeconds(42)
            .expiresAt(token.getExpiresAt())
            .build());

        mockMvc.perform(get("/api/attendance/qr/validity")
                .param("class_id", "C1")
                .param("date", "2025-01-20"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.active").value(true))
            .andExpect(jsonPath("$.remainingSeconds").value(42));
    }
}
