package com.example.qrattendance.util;

import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * HMAC-SHA256 based tag over the canonical token fields.
 */
@Slf4j
@Component
public class HmacTokenSigner implements TokenSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private static final String[] PLACEHOLDER_PATTERNS = {
        "CHANGE", "change", "SECRET", "secret", "PLEASE", "please",
        "PASSWORD", "password", "EXAMPLE", "example", "DEFAULT", "default",
        "123456", "qwerty"
    };

    private final SecretKey key;

    public HmacTokenSigner(@Value("${attendance.qr.secret:}") String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException(
                "attendance.qr.secret is not set. Generate one with: openssl rand -base64 48");
        }
        try {
            this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        } catch (WeakKeyException e) {
            throw new IllegalStateException("attendance.qr.secret must be at least 32 bytes", e);
        }
        for (String pattern : PLACEHOLDER_PATTERNS) {
            if (secret.contains(pattern)) {
                throw new IllegalStateException(String.format(
                    "attendance.qr.secret contains placeholder pattern '%s'. "
                        + "Generate one with: openssl rand -base64 48", pattern));
            }
        }
        // fail at startup rather than on the first scan
        newMac();
        log.info("QR token signer initialized with {}", ALGORITHM);
    }

    @Override
    public String sign(String fields) {
        byte[] digest = newMac().doFinal(fields.getBytes(StandardCharsets.UTF_8));
        return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
    }

    @Override
    public boolean verify(String fields, String tag) {
        if (tag == null) {
            return false;
        }
        byte[] expected = sign(fields).getBytes(StandardCharsets.US_ASCII);
        byte[] actual = tag.getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }

    private Mac newMac() {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }
}
