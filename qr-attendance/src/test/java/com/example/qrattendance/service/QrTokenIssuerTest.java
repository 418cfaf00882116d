package com.example.qrattendance.service;

import com.example.qrattendance.entity.QrToken;
import com.example.qrattendance.repository.InMemoryQrTokenStore;
import com.example.qrattendance.support.MutableClock;
import com.example.qrattendance.support.TestTokens;
import com.example.qrattendance.util.HmacTokenSigner;
import com.example.qrattendance.util.QrTokenCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

class QrTokenIssuerTest {

    private static final LocalDate DATE = LocalDate.of(2025, 1, 20);
    private static final LocalTime START = LocalTime.of(14, 0);

    private MutableClock clock;
    private InMemoryQrTokenStore store;
    private HmacTokenSigner signer;
    private QrTokenCodec codec;
    private QrTokenIssuer issuer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-20T04:55:00.123456Z"));
        store = new InMemoryQrTokenStore(clock);
        signer = TestTokens.signer();
        codec = new QrTokenCodec(TestTokens.objectMapper());
        issuer = new QrTokenIssuer(store, signer, codec, TestTokens.defaultPolicy(), clock);
    }

    @Test
    void testIssueCreatesSignedTokenWithValidityWindow() {
        QrToken token = issuer.issue("C1", DATE, START, "academy-001");

        assertEquals("C1", token.getClassId());
        assertEquals(DATE, token.getDate());
        assertEquals(START, token.getClassStartTime());
        assertEquals(Instant.parse("2025-01-20T04:55:00.123Z"), token.getIssuedAt());
        assertEquals(Duration.ofMinutes(2), Duration.between(token.getIssuedAt(), token.getExpiresAt()));
        assertTrue(signer.verify(codec.signingInput(token), token.getTag()));
        assertEquals(token, store.get("C1", DATE).orElseThrow());
    }

    @Test
    void testSignatureSurvivesEncoding() {
        QrToken token = issuer.issue("C1", DATE, LocalTime.of(14, 0, 45), "academy-001");
        QrToken decoded = codec.decode(codec.encode(token));

        assertTrue(signer.verify(codec.signingInput(decoded), decoded.getTag()));
    }

    @Test
    void testIssueReusesLiveToken() {
        QrToken first = issuer.issue("C1", DATE, START, "academy-001");
        clock.advance(Duration.ofSeconds(60));

        QrToken second = issuer.issue("C1", DATE, START, "academy-001");

        assertEquals(first.getNonce(), second.getNonce());
    }

    @Test
    void testIssueAfterExpiryCreatesNewToken() {
        QrToken first = issuer.issue("C1", DATE, START, "academy-001");
        clock.advance(Duration.ofMinutes(2).plusMillis(1));

        QrToken second = issuer.issue("C1", DATE, START, "academy-001");

        assertNotEquals(first.getNonce(), second.getNonce());
        assertTrue(second.getIssuedAt().isAfter(first.getIssuedAt()));
    }

    @Test
    void testRefreshReplacesLiveToken() {
        QrToken first = issuer.issue("C1", DATE, START, "academy-001");

        QrToken refreshed = issuer.refresh("C1", DATE, START, "academy-001");

        assertNotEquals(first.getNonce(), refreshed.getNonce());
        QrToken current = store.get("C1", DATE).orElseThrow();
        assertTrue(current.isSameIssuance(refreshed));
        assertFalse(current.isSameIssuance(first));
    }

    @Test
    void testNoncesAreUnique() {
        QrToken a = issuer.refresh("C1", DATE, START, "academy-001");
        QrToken b = issuer.refresh("C1", DATE, START, "academy-001");
        QrToken c = issuer.issue("C2", DATE, START, "academy-001");

        assertNotEquals(a.getNonce(), b.getNonce());
        assertNotEquals(b.getNonce(), c.getNonce());
        assertEquals(22, a.getNonce().length());
    }
}
