package com.ryuqq.artledger.core.model;

/**
 * Seed로부터 선택된 렌더링 속성.
 *
 * @param colorA 첫 번째 색상 (24-bit RGB, 배경 그라디언트 시작 및 주 도형)
 * @param colorB 두 번째 색상 (24-bit RGB, 배경 그라디언트 끝 및 보조 도형)
 * @param shape 전경 도형
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public record Attributes(
    int colorA,
    int colorB,
    Shape shape
) {

    /**
     * 24-bit 색상 최댓값.
     */
    public static final int MAX_COLOR = 0xFFFFFF;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 색상이 24-bit 범위를 벗어나거나 shape가 null인 경우
     */
    public Attributes {
        if (colorA < 0 || colorA > MAX_COLOR) {
            throw new IllegalArgumentException("colorA must be a 24-bit value (current: " + colorA + ")");
        }
        if (colorB < 0 || colorB > MAX_COLOR) {
            throw new IllegalArgumentException("colorB must be a 24-bit value (current: " + colorB + ")");
        }
        if (shape == null) {
            throw new IllegalArgumentException("shape cannot be null");
        }
    }
}
