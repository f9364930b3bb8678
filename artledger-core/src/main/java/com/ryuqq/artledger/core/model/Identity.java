package com.ryuqq.artledger.core.model;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * 계정 식별자 (20 byte).
 *
 * <p>자산의 소유자, 위임자(delegate), 운영자(operator), 호출자(caller)를 모두 Identity로 표현합니다.
 * 모든 바이트가 0인 값은 {@link #NULL}이며 "주인 없음"을 의미합니다.</p>
 *
 * <p><strong>표기:</strong> {@code 0x} + 소문자 16진수 40자</p>
 * <pre>
 * Identity alice = Identity.of("0x00000000000000000000000000000000000a11ce");
 * Identity.NULL.isNull(); // true
 * </pre>
 *
 * <p><strong>불변성:</strong> 내부 배열은 생성 시와 조회 시 모두 복사됩니다.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public final class Identity {

    /**
     * Identity 바이트 길이.
     */
    public static final int LENGTH = 20;

    /**
     * Null identity (0x000...000).
     */
    public static final Identity NULL = new Identity(new byte[LENGTH]);

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] value;

    private Identity(byte[] value) {
        this.value = value;
    }

    /**
     * 16진수 문자열로부터 Identity 생성.
     *
     * @param hex {@code 0x} 접두사가 붙은 40자리 16진수 (대소문자 무관)
     * @return Identity 인스턴스
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public static Identity of(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("Identity cannot be null or blank");
        }
        if (!hex.startsWith("0x") || hex.length() != 2 + LENGTH * 2) {
            throw new IllegalArgumentException("Identity must be 0x followed by 40 hex characters: " + hex);
        }
        try {
            return new Identity(HEX.parseHex(hex, 2, hex.length()));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Identity contains invalid hex characters: " + hex, e);
        }
    }

    /**
     * 원시 바이트로부터 Identity 생성.
     *
     * @param bytes 20 byte 배열
     * @return Identity 인스턴스
     * @throws IllegalArgumentException null 이거나 길이가 20이 아닌 경우
     */
    public static Identity of(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Identity bytes cannot be null");
        }
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("Identity must be exactly " + LENGTH + " bytes, got " + bytes.length);
        }
        return new Identity(bytes.clone());
    }

    /**
     * Null identity 여부.
     *
     * @return 모든 바이트가 0이면 true
     */
    public boolean isNull() {
        for (byte b : value) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * 원시 바이트 조회 (복사본).
     *
     * @return 20 byte 배열
     */
    public byte[] toBytes() {
        return value.clone();
    }

    /**
     * {@code 0x} 접두사가 붙은 소문자 16진수 표기.
     *
     * @return 16진수 문자열
     */
    public String toHex() {
        return "0x" + HEX.formatHex(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Identity identity = (Identity) o;
        return Arrays.equals(value, identity.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
