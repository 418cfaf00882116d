package com.example.qrattendance.util;

import com.example.qrattendance.entity.QrToken;
import com.example.qrattendance.exception.InvalidQrTokenException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import static com.example.qrattendance.exception.InvalidQrTokenException.Reason.INVALID_PAYLOAD;

/**
 * QR 코드에 담기는 토큰 문자열(JSON) 인코딩/디코딩.
 *
 * <pre>
 * {"academyId":"academy-001","classId":"C1","date":"2025-01-20","classStartTime":"14:00",
 *  "issuedAt":"2025-01-20T04:55:00Z","expiresAt":"2025-01-20T04:57:00Z",
 *  "nonce":"...","tag":"..."}
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class QrTokenCodec {

    public static final DateTimeFormatter START_TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private static final int MAX_PAYLOAD_LENGTH = 2048;
    private static final String SIGNING_VERSION = "qr-attendance-v1";

    private final ObjectMapper objectMapper;

    public String encode(QrToken token) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("academyId", token.getAcademyId());
        node.put("classId", token.getClassId());
        node.put("date", token.getDate().toString());
        node.put("classStartTime", START_TIME_FORMAT.format(token.getClassStartTime()));
        node.put("issuedAt", token.getIssuedAt().toString());
        node.put("expiresAt", token.getExpiresAt().toString());
        node.put("nonce", token.getNonce());
        node.put("tag", token.getTag());
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode QR token", e);
        }
    }

    public QrToken decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new InvalidQrTokenException(INVALID_PAYLOAD, "QR payload is empty");
        }
        if (payload.length() > MAX_PAYLOAD_LENGTH) {
            throw new InvalidQrTokenException(INVALID_PAYLOAD, "QR payload is too long");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new InvalidQrTokenException(INVALID_PAYLOAD, "QR payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidQrTokenException(INVALID_PAYLOAD, "QR payload is not a JSON object");
        }

        try {
            return QrToken.builder()
                .academyId(requiredText(root, "academyId"))
                .classId(requiredText(root, "classId"))
                .date(LocalDate.parse(requiredText(root, "date")))
                .classStartTime(LocalTime.parse(requiredText(root, "classStartTime"), START_TIME_FORMAT))
                .issuedAt(Instant.parse(requiredText(root, "issuedAt")))
                .expiresAt(Instant.parse(requiredText(root, "expiresAt")))
                .nonce(requiredText(root, "nonce"))
                .tag(requiredText(root, "tag"))
                .build();
        } catch (DateTimeParseException e) {
            throw new InvalidQrTokenException(INVALID_PAYLOAD, "QR payload has a malformed date or time", e);
        }
    }

    /**
     * Canonical string the tag is computed over. Every field is length-prefixed so a
     * separator inside an id cannot move a field boundary. Instants keep their full
     * precision, so the tag covers exactly the values {@link #decode} produces.
     */
    public String signingInput(QrToken token) {
        StringBuilder sb = new StringBuilder(SIGNING_VERSION);
        appendField(sb, token.getAcademyId());
        appendField(sb, token.getClassId());
        appendField(sb, token.getDate().toString());
        appendField(sb, START_TIME_FORMAT.format(token.getClassStartTime()));
        appendField(sb, token.getIssuedAt().toString());
        appendField(sb, token.getExpiresAt().toString());
        appendField(sb, token.getNonce());
        return sb.toString();
    }

    private void appendField(StringBuilder sb, String value) {
        sb.append('|').append(value.length()).append(':').append(value);
    }

    private String requiredText(JsonNode root, String field) {
        JsonNode value = root.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new InvalidQrTokenException(INVALID_PAYLOAD, "QR payload is missing field: " + field);
        }
        return value.asText();
    }
}
