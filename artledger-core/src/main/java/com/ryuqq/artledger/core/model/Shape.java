package com.ryuqq.artledger.core.model;

/**
 * 작품의 전경 도형 종류.
 *
 * <p>Seed를 3으로 나눈 나머지로 결정됩니다:</p>
 * <ul>
 *   <li>0 → {@link #CIRCLES}</li>
 *   <li>1 → {@link #RECTANGLES}</li>
 *   <li>2 → {@link #STAR_POLYGON}</li>
 * </ul>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public enum Shape {

    /**
     * 동심원 두 개.
     */
    CIRCLES("Concentric Circles"),

    /**
     * 25도 회전된 둥근 사각형 두 개.
     */
    RECTANGLES("Rounded Rectangles"),

    /**
     * 10개 꼭짓점의 별과 중앙 원.
     */
    STAR_POLYGON("Star Polygon");

    private final String displayName;

    Shape(String displayName) {
        this.displayName = displayName;
    }

    /**
     * 메타데이터 "shape" 속성에 노출되는 이름.
     *
     * @return 표시 이름
     */
    public String displayName() {
        return displayName;
    }

    /**
     * 도형 번호(0~2)로부터 Shape 조회.
     *
     * @param kind 도형 번호
     * @return Shape
     * @throws IllegalArgumentException 0~2 범위를 벗어난 경우
     */
    public static Shape fromKind(int kind) {
        return switch (kind) {
            case 0 -> CIRCLES;
            case 1 -> RECTANGLES;
            case 2 -> STAR_POLYGON;
            default -> throw new IllegalArgumentException("Shape kind must be 0, 1 or 2 (current: " + kind + ")");
        };
    }
}
