package com.example.qrattendance.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * 외부 어댑터(명단 조회, 출석 기록) 호출이 제한 시간 안에 끝나지 않은 경우.
 * 내부에서 재시도하지 않으며 호출 측이 검증 전체를 다시 시도할 수 있다.
 */
@Getter
public class AdapterTimeoutException extends RuntimeException {

    private final String operation;
    private final Duration timeout;

    public AdapterTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(String.format("%s did not complete within %d ms", operation, timeout.toMillis()), cause);
        this.operation = operation;
        this.timeout = timeout;
    }
}
