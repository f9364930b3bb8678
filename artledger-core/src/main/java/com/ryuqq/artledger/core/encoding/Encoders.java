package com.ryuqq.artledger.core.encoding;

import java.math.BigInteger;

/**
 * 메타데이터 조립용 저수준 인코딩 유틸리티.
 *
 * <p>모든 변환은 직접 구현한 고정 알고리즘이며, 결과는 바이트 단위로 고정되어 있습니다.</p>
 * <ul>
 *   <li>{@link #toHex24(int)}: 24-bit 값 → 소문자 16진수 6자</li>
 *   <li>{@link #toDecimal(long)}, {@link #toDecimal(BigInteger)}: 음이 아닌 정수 → 10진수 문자열</li>
 *   <li>{@link #escapeJson(String)}: {@code "} 와 {@code \} 만 이스케이프</li>
 *   <li>{@link #dataUri(String, String)}: {@code data:<mime>;utf8,<body>}</li>
 * </ul>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public final class Encoders {

    private static final char[] HEX_ALPHABET = "0123456789abcdef".toCharArray();

    private static final int HEX24_DIGITS = 6;

    // Utility class - prevent instantiation
    private Encoders() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 24-bit 값을 16진수 6자리로 변환.
     *
     * <p>최상위 nibble부터 기록하며 구분자와 {@code #} 접두사는 없습니다.</p>
     * <pre>
     * toHex24(0)        → "000000"
     * toHex24(0xFFFFFF) → "ffffff"
     * toHex24(0x0A0B0C) → "0a0b0c"
     * </pre>
     *
     * @param value 0 ~ 0xFFFFFF
     * @return 소문자 16진수 6자
     * @throws IllegalArgumentException 범위를 벗어난 경우
     */
    public static String toHex24(int value) {
        if (value < 0 || value > 0xFFFFFF) {
            throw new IllegalArgumentException("value must be a 24-bit unsigned integer (current: " + value + ")");
        }
        char[] out = new char[HEX24_DIGITS];
        for (int i = 0; i < HEX24_DIGITS; i++) {
            int shift = (HEX24_DIGITS - 1 - i) * 4;
            out[i] = HEX_ALPHABET[(value >> shift) & 0xF];
        }
        return new String(out);
    }

    /**
     * 음이 아닌 정수를 10진수 문자열로 변환.
     *
     * <p>앞자리 0 없이 기록하며, 0은 {@code "0"}입니다.</p>
     *
     * @param value 0 이상의 값
     * @return 10진수 문자열
     * @throws IllegalArgumentException 음수인 경우
     */
    public static String toDecimal(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("value must be non-negative (current: " + value + ")");
        }
        if (value == 0) {
            return "0";
        }
        int digits = 0;
        for (long temp = value; temp != 0; temp /= 10) {
            digits++;
        }
        char[] out = new char[digits];
        long remaining = value;
        while (remaining != 0) {
            digits--;
            out[digits] = (char) ('0' + (remaining % 10));
            remaining /= 10;
        }
        return new String(out);
    }

    /**
     * 부호 없는 임의 정밀도 정수를 10진수 문자열로 변환 (256-bit seed 등).
     *
     * @param value 0 이상의 값
     * @return 10진수 문자열
     * @throws IllegalArgumentException null 이거나 음수인 경우
     */
    public static String toDecimal(BigInteger value) {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException("value must be non-negative (current: " + value + ")");
        }
        if (value.signum() == 0) {
            return "0";
        }
        StringBuilder reversed = new StringBuilder();
        BigInteger remaining = value;
        while (remaining.signum() != 0) {
            BigInteger[] qr = remaining.divideAndRemainder(BigInteger.TEN);
            reversed.append((char) ('0' + qr[1].intValue()));
            remaining = qr[0];
        }
        return reversed.reverse().toString();
    }

    /**
     * JSON 문자열 값용 최소 이스케이프.
     *
     * <p>{@code "} → {@code \"}, {@code \} → {@code \\} 만 치환하고 나머지 문자는
     * 제어 문자를 포함해 그대로 복사합니다. 내부에서 생성한 텍스트 전용입니다.</p>
     *
     * @param input 원본 문자열
     * @return 이스케이프된 문자열
     * @throws IllegalArgumentException input이 null인 경우
     */
    public static String escapeJson(String input) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        StringBuilder out = new StringBuilder(input.length() + 16);
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c == '"') {
                out.append('\\').append('"');
            } else if (c == '\\') {
                out.append('\\').append('\\');
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * 자기 기술형 문자열(data URI) 생성.
     *
     * @param mimeType MIME 타입 (예: image/svg+xml)
     * @param body 본문 (인코딩 없이 그대로 삽입)
     * @return {@code data:<mimeType>;utf8,<body>}
     */
    public static String dataUri(String mimeType, String body) {
        if (mimeType == null || mimeType.isBlank()) {
            throw new IllegalArgumentException("mimeType cannot be null or blank");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        return "data:" + mimeType + ";utf8," + body;
    }
}
