package com.ryuqq.artledger.core.metadata;

import com.ryuqq.artledger.core.encoding.Encoders;
import com.ryuqq.artledger.core.model.Attributes;
import com.ryuqq.artledger.core.model.TokenId;

/**
 * 400x400 SVG 문서 렌더러.
 *
 * <p><strong>구성:</strong></p>
 * <ol>
 *   <li>colorA → colorB 대각선 선형 그라디언트 배경</li>
 *   <li>도형별 전경 ({@link com.ryuqq.artledger.core.model.Shape})</li>
 *   <li>(200, 380) 위치의 "AI Artwork #&lt;id&gt;" 라벨</li>
 * </ol>
 *
 * <p>출력은 줄바꿈 없는 한 줄 마크업이며 속성 값은 큰따옴표로 감쌉니다.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public final class SvgRenderer {

    /**
     * 라벨 및 메타데이터 name 접두사.
     */
    public static final String LABEL_PREFIX = "AI Artwork #";

    static final String STAR_POINTS =
        "200,70 232,156 324,160 252,217 276,305 200,255 124,305 148,217 76,160 168,156";

    private static final String HEADER =
        "<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"400\" height=\"400\" viewBox=\"0 0 400 400\">";

    public String render(TokenId tokenId, Attributes attributes) {
        if (tokenId == null) {
            throw new IllegalArgumentException("tokenId cannot be null");
        }
        if (attributes == null) {
            throw new IllegalArgumentException("attributes cannot be null");
        }
        String colorA = color(attributes.colorA());
        String colorB = color(attributes.colorB());

        StringBuilder svg = new StringBuilder(1024);
        svg.append(HEADER);
        appendBackground(svg, colorA, colorB);
        switch (attributes.shape()) {
            case CIRCLES -> appendCircles(svg, colorA, colorB);
            case RECTANGLES -> appendRectangles(svg, colorA, colorB);
            case STAR_POLYGON -> appendStar(svg, colorA, colorB);
        }
        appendLabel(svg, tokenId);
        svg.append("</svg>");
        return svg.toString();
    }

    private static void appendBackground(StringBuilder svg, String colorA, String colorB) {
        svg.append("<defs><linearGradient id=\"bg\" x1=\"0\" y1=\"0\" x2=\"1\" y2=\"1\">")
            .append("<stop offset=\"0%\" stop-color=\"").append(colorA).append("\"/>")
            .append("<stop offset=\"100%\" stop-color=\"").append(colorB).append("\"/>")
            .append("</linearGradient></defs>")
            .append("<rect width=\"400\" height=\"400\" fill=\"url(#bg)\"/>");
    }

    private static void appendCircles(StringBuilder svg, String colorA, String colorB) {
        svg.append("<circle cx=\"200\" cy=\"200\" r=\"120\" fill=\"").append(colorA)
            .append("\" fill-opacity=\"0.95\"/>")
            .append("<circle cx=\"200\" cy=\"200\" r=\"70\" fill=\"").append(colorB)
            .append("\" fill-opacity=\"0.85\"/>");
    }

    private static void appendRectangles(StringBuilder svg, String colorA, String colorB) {
        svg.append("<g transform=\"rotate(25 200 200)\">")
            .append("<rect x=\"80\" y=\"80\" width=\"240\" height=\"240\" rx=\"30\" fill=\"").append(colorA)
            .append("\"/>")
            .append("<rect x=\"110\" y=\"110\" width=\"180\" height=\"180\" rx=\"25\" fill=\"").append(colorB)
            .append("\" fill-opacity=\"0.9\"/>")
            .append("</g>");
    }

    private static void appendStar(StringBuilder svg, String colorA, String colorB) {
        svg.append("<polygon points=\"").append(STAR_POINTS).append("\" fill=\"").append(colorA).append("\"/>")
            .append("<circle cx=\"200\" cy=\"200\" r=\"45\" fill=\"").append(colorB).append("\"/>");
    }

    private static void appendLabel(StringBuilder svg, TokenId tokenId) {
        svg.append("<text x=\"200\" y=\"380\" font-family=\"monospace\" font-size=\"18\" fill=\"#ffffff\"")
            .append(" text-anchor=\"middle\">")
            .append(LABEL_PREFIX).append(Encoders.toDecimal(tokenId.getValue()))
            .append("</text>");
    }

    private static String color(int rgb) {
        return "#" + Encoders.toHex24(rgb);
    }
}
