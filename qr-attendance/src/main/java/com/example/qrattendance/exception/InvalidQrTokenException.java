package com.example.qrattendance.exception;

import lombok.Getter;

/**
 * 스캔한 QR 페이로드가 진위/유효성 검사를 통과하지 못한 경우.
 * 사용자에게는 "다시 스캔" 류의 오류로 노출된다.
 */
@Getter
public class InvalidQrTokenException extends RuntimeException {

    private final Reason reason;

    public InvalidQrTokenException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public InvalidQrTokenException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public enum Reason {
        INVALID_PAYLOAD,
        TAMPERED_TOKEN,
        NO_ACTIVE_TOKEN,
        STALE_TOKEN,
        NOT_YET_OPEN
    }
}
