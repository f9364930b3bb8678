package com.ryuqq.artledger.core.model;

import java.math.BigInteger;

/**
 * 256-bit 의사 난수 seed.
 *
 * <p>메타데이터 조회 시마다 새로 계산되며 저장되지 않습니다.</p>
 *
 * @param value 0 이상 2^256 미만의 값
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public record Seed(BigInteger value) {

    /**
     * Seed 비트 폭.
     */
    public static final int BITS = 256;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException null 이거나 256-bit 부호 없는 범위를 벗어난 경우
     */
    public Seed {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (value.signum() < 0 || value.bitLength() > BITS) {
            throw new IllegalArgumentException("Seed must be an unsigned 256-bit value");
        }
    }

    /**
     * 32 byte big-endian digest로부터 Seed 생성.
     *
     * @param digest 해시 결과
     * @return Seed 인스턴스
     */
    public static Seed fromDigest(byte[] digest) {
        if (digest == null || digest.length == 0) {
            throw new IllegalArgumentException("digest cannot be null or empty");
        }
        return new Seed(new BigInteger(1, digest));
    }

    /**
     * {@code [offset, offset + width)} 비트 구간 추출.
     *
     * @param offset 최하위 비트 기준 시작 위치
     * @param width 추출할 비트 수 (1~31)
     * @return 추출된 값
     */
    public int bits(int offset, int width) {
        if (offset < 0 || width <= 0 || width > 31 || offset + width > BITS) {
            throw new IllegalArgumentException("Invalid bit range: offset=" + offset + ", width=" + width);
        }
        return value.shiftRight(offset).intValue() & ((1 << width) - 1);
    }

    /**
     * {@code value mod divisor}.
     *
     * @param divisor 양수
     * @return 나머지
     */
    public int mod(int divisor) {
        if (divisor <= 0) {
            throw new IllegalArgumentException("divisor must be positive (current: " + divisor + ")");
        }
        return value.mod(BigInteger.valueOf(divisor)).intValue();
    }
}
