package com.ryuqq.artledger.core.metadata;

import com.ryuqq.artledger.core.model.EntropySnapshot;
import com.ryuqq.artledger.core.model.Identity;
import com.ryuqq.artledger.core.model.Seed;
import com.ryuqq.artledger.core.model.TokenId;

import java.math.BigInteger;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Seed 계산기.
 *
 * <p>엔트로피 snapshot, 자산 식별자, 원장 identity를 packed 형태로 이어 붙여 해시합니다.</p>
 *
 * <p><strong>입력 배치 (총 116 byte):</strong></p>
 * <pre>
 * blockHash   32 byte
 * timestamp   32 byte (uint256 big-endian)
 * tokenId     32 byte (uint256 big-endian)
 * ledger      20 byte
 * </pre>
 *
 * <p>원장을 읽거나 변경하지 않는 순수 계산입니다.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public final class SeedDeriver {

    private static final int WORD = 32;
    private static final int DIGEST_LENGTH = 32;

    private final String algorithm;
    private final Identity ledgerIdentity;

    /**
     * 생성자.
     *
     * @param algorithm MessageDigest 알고리즘 이름 (256-bit 출력)
     * @param ledgerIdentity 원장 identity
     * @throws IllegalArgumentException 알고리즘이 없거나 출력 길이가 32 byte가 아닌 경우
     */
    public SeedDeriver(String algorithm, Identity ledgerIdentity) {
        if (ledgerIdentity == null) {
            throw new IllegalArgumentException("ledgerIdentity cannot be null");
        }
        int length = newDigest(algorithm).getDigestLength();
        if (length != DIGEST_LENGTH) {
            throw new IllegalArgumentException(
                "Digest algorithm must produce 256 bits: " + algorithm + " produces " + (length * 8)
            );
        }
        this.algorithm = algorithm;
        this.ledgerIdentity = ledgerIdentity;
    }

    /**
     * Seed 계산.
     *
     * @param entropy 호스트 엔트로피
     * @param tokenId 자산 식별자
     * @return 256-bit seed
     */
    public Seed derive(EntropySnapshot entropy, TokenId tokenId) {
        if (entropy == null) {
            throw new IllegalArgumentException("entropy cannot be null");
        }
        if (tokenId == null) {
            throw new IllegalArgumentException("tokenId cannot be null");
        }
        MessageDigest digest = newDigest(algorithm);
        digest.update(entropy.blockHash());
        digest.update(word(entropy.timestamp()));
        digest.update(word(tokenId.getValue()));
        digest.update(ledgerIdentity.toBytes());
        return Seed.fromDigest(digest.digest());
    }

    /**
     * 음이 아닌 long 값을 32 byte big-endian 워드로 변환.
     */
    static byte[] word(long value) {
        byte[] raw = BigInteger.valueOf(value).toByteArray();
        byte[] out = new byte[WORD];
        int copy = Math.min(raw.length, WORD);
        System.arraycopy(raw, raw.length - copy, out, WORD - copy, copy);
        return out;
    }

    private static MessageDigest newDigest(String algorithm) {
        if (algorithm == null || algorithm.isBlank()) {
            throw new IllegalArgumentException("algorithm cannot be null or blank");
        }
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported digest algorithm: " + algorithm, e);
        }
    }
}
