/**
 * 메타데이터 엔진 - 결정적 tokenURI 생성.
 *
 * <p>현재 호스트 엔트로피와 자산 식별자로부터 seed를 계산하고, seed에서 색상과 도형을 고른 뒤
 * SVG 이미지와 JSON 문서를 data URI로 조립합니다. 결과는 저장되지 않으며 엔트로피가 바뀌면
 * 같은 자산이라도 다른 문서가 나옵니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.artledger.core.metadata.SeedDeriver}</li>
 *   <li>{@link com.ryuqq.artledger.core.metadata.AttributeSelector}</li>
 *   <li>{@link com.ryuqq.artledger.core.metadata.SvgRenderer}</li>
 *   <li>{@link com.ryuqq.artledger.core.metadata.MetadataAssembler}</li>
 *   <li>{@link com.ryuqq.artledger.core.metadata.MetadataEngine} - 위 단계를 잇는 파이프라인</li>
 * </ul>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
package com.ryuqq.artledger.core.metadata;
