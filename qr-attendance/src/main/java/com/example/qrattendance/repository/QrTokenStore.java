package com.example.qrattendance.repository;

import com.example.qrattendance.entity.QrToken;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 수업/날짜별 현재 QR 토큰 저장소.
 * 키 하나에 최대 하나의 토큰만 존재하며, 만료된 항목은 조회 시 없는 것으로 취급한다.
 */
public interface QrTokenStore {

    /**
     * 현재 유효한 토큰 조회. {@code now > expiresAt} 인 항목은 비어 있는 것으로 반환한다.
     */
    Optional<QrToken> get(String classId, LocalDate date);

    /**
     * 기존 항목을 무조건 교체한다. 갱신 시 이전 토큰은 만료 시각과 무관하게 즉시 무효가 된다.
     */
    void put(String classId, LocalDate date, QrToken token);

    void invalidate(String classId, LocalDate date);

    /**
     * 유효한 토큰이 있으면 그대로 반환하고, 없으면 supplier 가 만든 토큰을 원자적으로 저장한다.
     */
    QrToken getOrCreate(String classId, LocalDate date, Supplier<QrToken> tokenSupplier);

    /**
     * 만료된 항목을 제거하고 제거된 토큰 목록을 반환한다.
     */
    List<QrToken> evictExpired();

    int activeCount();
}
