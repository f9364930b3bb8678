package com.ryuqq.artledger.core.metadata;

import com.ryuqq.artledger.core.encoding.Encoders;
import com.ryuqq.artledger.core.model.Attributes;
import com.ryuqq.artledger.core.model.TokenId;

/**
 * tokenURI JSON 문서 조립기.
 *
 * <p><strong>출력 형태:</strong></p>
 * <pre>
 * data:application/json;utf8,{"name":"AI Artwork #1","description":"...",
 *   "attributes":[{"trait_type":"palette","value":"#aaaaaa / #bbbbbb"},
 *                 {"trait_type":"shape","value":"Star Polygon"}],
 *   "image":"data:image/svg+xml;utf8,&lt;svg ...&gt;"}
 * </pre>
 *
 * <p>name, description, image 세 필드는 삽입 전에 {@link Encoders#escapeJson(String)}을 거칩니다.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public final class MetadataAssembler {

    public static final String JSON_MIME_TYPE = "application/json";
    public static final String SVG_MIME_TYPE = "image/svg+xml";

    private final String description;

    /**
     * 생성자.
     *
     * @param description 모든 자산에 공통인 description
     */
    public MetadataAssembler(String description) {
        if (description == null) {
            throw new IllegalArgumentException("description cannot be null");
        }
        this.description = description;
    }

    /**
     * 메타데이터 문서 조립.
     *
     * @param tokenId 자산 식별자
     * @param attributes 선택된 속성
     * @param svg 렌더링된 SVG 문서
     * @return {@code application/json} data URI
     */
    public String assemble(TokenId tokenId, Attributes attributes, String svg) {
        if (tokenId == null || attributes == null || svg == null) {
            throw new IllegalArgumentException("tokenId, attributes and svg cannot be null");
        }
        String name = SvgRenderer.LABEL_PREFIX + Encoders.toDecimal(tokenId.getValue());
        String palette = "#" + Encoders.toHex24(attributes.colorA()) + " / #" + Encoders.toHex24(attributes.colorB());
        String image = Encoders.dataUri(SVG_MIME_TYPE, svg);

        StringBuilder json = new StringBuilder(svg.length() + 512);
        json.append("{\"name\":\"").append(Encoders.escapeJson(name)).append('"')
            .append(",\"description\":\"").append(Encoders.escapeJson(description)).append('"')
            .append(",\"attributes\":[")
            .append("{\"trait_type\":\"palette\",\"value\":\"").append(palette).append("\"},")
            .append("{\"trait_type\":\"shape\",\"value\":\"").append(attributes.shape().displayName()).append("\"}")
            .append(']')
            .append(",\"image\":\"").append(Encoders.escapeJson(image)).append('"')
            .append('}');
        return Encoders.dataUri(JSON_MIME_TYPE, json.toString());
    }
}
