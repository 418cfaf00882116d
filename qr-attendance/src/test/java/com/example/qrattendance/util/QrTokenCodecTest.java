package com.example.qrattendance.util;

import com.example.qrattendance.entity.QrToken;
import com.example.qrattendance.exception.InvalidQrTokenException;
import com.example.qrattendance.support.TestTokens;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

class QrTokenCodecTest {

    private final QrTokenCodec codec = new QrTokenCodec(TestTokens.objectMapper());

    private QrToken sampleToken() {
        return QrToken.builder()
            .academyId("academy-001")
            .classId("C1")
            .date(LocalDate.of(2025, 1, 20))
            .classStartTime(LocalTime.of(14, 0))
            .issuedAt(Instant.parse("2025-01-20T04:55:00.123Z"))
            .expiresAt(Instant.parse("2025-01-20T04:57:00.123Z"))
            .nonce("Yk3n0bq2T0mB8v1Qx9Lr4A")
            .tag("tag-value")
            .build();
    }

    @Test
    void testDecodeRestoresEncodedToken() {
        QrToken token = sampleToken();

        QrToken decoded = codec.decode(codec.encode(token));

        assertEquals(token, decoded);
        assertTrue(token.isSameIssuance(decoded));
    }

    @Test
    void testEncodedPayloadUsesReadableFields() {
        String payload = codec.encode(sampleToken());

        assertTrue(payload.contains("\"classId\":\"C1\""));
        assertTrue(payload.contains("\"date\":\"2025-01-20\""));
        assertTrue(payload.contains("\"classStartTime\":\"14:00\""));
    }

    @Test
    void testSigningInputLengthPrefixesFields() {
        String input = codec.signingInput(sampleToken());

        assertTrue(input.startsWith("qr-attendance-v1|11:academy-001|2:C1|10:2025-01-20|5:14:00|"));
        assertFalse(input.contains("tag-value"));
    }

    @Test
    void testSigningInputDistinguishesShiftedSeparators() {
        QrToken a = sampleToken().toBuilder().academyId("a|1").classId("b").build();
        QrToken b = sampleToken().toBuilder().academyId("a").classId("1|b").build();

        assertNotEquals(codec.signingInput(a), codec.signingInput(b));
    }

    @Test
    void testSigningInputKeepsFullTimestampPrecision() {
        QrToken token = sampleToken();
        QrToken shifted = token.toBuilder().expiresAt(token.getExpiresAt().plusNanos(999)).build();

        assertNotEquals(codec.signingInput(token), codec.signingInput(shifted));
        assertEquals(codec.signingInput(shifted), codec.signingInput(codec.decode(codec.encode(shifted))));
    }

    @Test
    void testDecodeRejectsMalformedPayloads() {
        assertInvalid(null);
        assertInvalid("");
        assertInvalid("not-json");
        assertInvalid("[1,2,3]");
        assertInvalid("{\"classId\":\"C1\"}");
        assertInvalid("x".repeat(5000));
    }

    @Test
    void testDecodeRejectsBadDate() {
        String payload = codec.encode(sampleToken()).replace("2025-01-20\"", "2025-13-40\"");

        assertInvalid(payload);
    }

    @Test
    void testDecodeRejectsNonTextField() {
        String payload = codec.encode(sampleToken()).replace("\"classId\":\"C1\"", "\"classId\":42");

        assertInvalid(payload);
    }

    private void assertInvalid(String payload) {
        InvalidQrTokenException e = assertThrows(InvalidQrTokenException.class, () -> codec.decode(payload));
        assertEquals(InvalidQrTokenException.Reason.INVALID_PAYLOAD, e.getReason());
    }
}
