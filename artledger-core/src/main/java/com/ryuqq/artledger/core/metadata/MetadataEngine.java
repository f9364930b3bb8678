package com.ryuqq.artledger.core.metadata;

import com.ryuqq.artledger.core.config.CollectionConfig;
import com.ryuqq.artledger.core.model.Attributes;
import com.ryuqq.artledger.core.model.EntropySnapshot;
import com.ryuqq.artledger.core.model.Seed;
import com.ryuqq.artledger.core.model.TokenId;
import com.ryuqq.artledger.core.spi.EntropySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 메타데이터 파이프라인.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * EntropySource.current()
 *   → SeedDeriver.derive()
 *   → AttributeSelector.select()
 *   → SvgRenderer.render()
 *   → MetadataAssembler.assemble()
 * </pre>
 *
 * <p>호출마다 새로 계산하며 캐시하지 않습니다. 자산 존재 여부는 호출자가 먼저 확인해야 합니다.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public final class MetadataEngine {

    private static final Logger log = LoggerFactory.getLogger(MetadataEngine.class);

    private final EntropySource entropySource;
    private final SeedDeriver seedDeriver;
    private final AttributeSelector attributeSelector;
    private final SvgRenderer renderer;
    private final MetadataAssembler assembler;

    /**
     * 설정으로부터 기본 구성 요소를 조립하는 생성자.
     *
     * @param config 컬렉션 설정
     * @param entropySource 호스트 엔트로피
     */
    public MetadataEngine(CollectionConfig config, EntropySource entropySource) {
        this(
            entropySource,
            new SeedDeriver(requireConfig(config).digestAlgorithm(), config.ledgerIdentity()),
            new AttributeSelector(),
            new SvgRenderer(),
            new MetadataAssembler(config.description())
        );
    }

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public MetadataEngine(
        EntropySource entropySource,
        SeedDeriver seedDeriver,
        AttributeSelector attributeSelector,
        SvgRenderer renderer,
        MetadataAssembler assembler
    ) {
        if (entropySource == null) {
            throw new IllegalArgumentException("entropySource cannot be null");
        }
        if (seedDeriver == null || attributeSelector == null || renderer == null || assembler == null) {
            throw new IllegalArgumentException("metadata components cannot be null");
        }
        this.entropySource = entropySource;
        this.seedDeriver = seedDeriver;
        this.attributeSelector = attributeSelector;
        this.renderer = renderer;
        this.assembler = assembler;
    }

    /**
     * 현재 엔트로피 기준 속성 계산.
     *
     * @param tokenId 자산 식별자
     * @return 선택된 속성
     */
    public Attributes attributesOf(TokenId tokenId) {
        return attributesOf(tokenId, currentEntropy());
    }

    /**
     * 현재 엔트로피 기준 tokenURI 문서 생성.
     *
     * @param tokenId 자산 식별자 (발행된 자산이어야 함)
     * @return {@code data:application/json;utf8,...}
     */
    public String tokenUri(TokenId tokenId) {
        Attributes attributes = attributesOf(tokenId, currentEntropy());
        String svg = renderer.render(tokenId, attributes);
        return assembler.assemble(tokenId, attributes, svg);
    }

    private Attributes attributesOf(TokenId tokenId, EntropySnapshot entropy) {
        if (tokenId == null) {
            throw new IllegalArgumentException("tokenId cannot be null");
        }
        Seed seed = seedDeriver.derive(entropy, tokenId);
        Attributes attributes = attributeSelector.select(seed);
        log.debug("Derived attributes for {} at timestamp {}: {}", tokenId, entropy.timestamp(), attributes);
        return attributes;
    }

    private EntropySnapshot currentEntropy() {
        EntropySnapshot entropy = entropySource.current();
        if (entropy == null) {
            throw new IllegalStateException("EntropySource returned no snapshot");
        }
        return entropy;
    }

    private static CollectionConfig requireConfig(CollectionConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }
}
