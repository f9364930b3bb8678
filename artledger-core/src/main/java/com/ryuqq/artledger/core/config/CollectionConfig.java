package com.ryuqq.artledger.core.config;

import com.ryuqq.artledger.core.model.Identity;

/**
 * 컬렉션 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>name: 컬렉션 이름 (기본 "AI Artwork")</li>
 *   <li>symbol: 컬렉션 심볼 (기본 "AIART")</li>
 *   <li>description: 메타데이터 description 상수</li>
 *   <li>digestAlgorithm: seed 해시 알고리즘 (기본 SHA3-256, 256-bit 출력 필수)</li>
 *   <li>ledgerIdentity: seed에 섞이는 원장 자신의 identity</li>
 * </ul>
 *
 * <p>description은 JSON 이스케이프 규칙상 {@code "} 와 {@code \} 외의
 * 이스케이프 대상 문자(제어 문자)를 포함할 수 없습니다.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 * @param name 컬렉션 이름
 * @param symbol 컬렉션 심볼
 * @param description 메타데이터 설명
 * @param digestAlgorithm {@link java.security.MessageDigest} 알고리즘 이름
 * @param ledgerIdentity 원장 identity (null identity 불가)
 */
public record CollectionConfig(
    String name,
    String symbol,
    String description,
    String digestAlgorithm,
    Identity ledgerIdentity
) {

    public static final String DEFAULT_NAME = "AI Artwork";
    public static final String DEFAULT_SYMBOL = "AIART";
    public static final String DEFAULT_DESCRIPTION =
        "Generative artwork whose palette and shape are derived from an on-demand hash seed.";
    public static final String DEFAULT_DIGEST_ALGORITHM = "SHA3-256";
    public static final Identity DEFAULT_LEDGER_IDENTITY =
        Identity.of("0x5fbdb2315678afecb367f032d93f642f64180aa3");

    /**
     * 기본 설정 생성자.
     */
    public CollectionConfig() {
        this(DEFAULT_NAME, DEFAULT_SYMBOL, DEFAULT_DESCRIPTION, DEFAULT_DIGEST_ALGORITHM, DEFAULT_LEDGER_IDENTITY);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CollectionConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol cannot be null or blank");
        }
        if (description == null) {
            throw new IllegalArgumentException("description cannot be null");
        }
        for (int i = 0; i < description.length(); i++) {
            if (description.charAt(i) < 0x20) {
                throw new IllegalArgumentException(
                    "description cannot contain control characters (index: " + i + ")"
                );
            }
        }
        if (digestAlgorithm == null || digestAlgorithm.isBlank()) {
            throw new IllegalArgumentException("digestAlgorithm cannot be null or blank");
        }
        if (ledgerIdentity == null || ledgerIdentity.isNull()) {
            throw new IllegalArgumentException("ledgerIdentity cannot be null or the null identity");
        }
    }

    public CollectionConfig withName(String name) {
        return new CollectionConfig(name, symbol, description, digestAlgorithm, ledgerIdentity);
    }

    public CollectionConfig withSymbol(String symbol) {
        return new CollectionConfig(name, symbol, description, digestAlgorithm, ledgerIdentity);
    }

    public CollectionConfig withDescription(String description) {
        return new CollectionConfig(name, symbol, description, digestAlgorithm, ledgerIdentity);
    }

    public CollectionConfig withDigestAlgorithm(String digestAlgorithm) {
        return new CollectionConfig(name, symbol, description, digestAlgorithm, ledgerIdentity);
    }

    public CollectionConfig withLedgerIdentity(Identity ledgerIdentity) {
        return new CollectionConfig(name, symbol, description, digestAlgorithm, ledgerIdentity);
    }
}
