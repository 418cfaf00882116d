package com.example.qrattendance.util;

/**
 * QR 토큰 필드에 대한 진위 태그 생성/검증.
 */
public interface TokenSigner {

    String sign(String fields);

    boolean verify(String fields, String tag);
}
