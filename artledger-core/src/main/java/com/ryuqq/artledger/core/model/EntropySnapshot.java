package com.ryuqq.artledger.core.model;

import java.util.Arrays;

/**
 * 실행 호스트가 제공하는 시점별 엔트로피.
 *
 * <p>직전 블록 해시와 현재 타임스탬프 쌍입니다. 같은 snapshot 안에서만
 * 동일 자산의 메타데이터가 재현됩니다.</p>
 *
 * @param blockHash 직전 블록 해시 (32 byte)
 * @param timestamp 호스트 타임스탬프 (초, 음수 불가)
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public record EntropySnapshot(
    byte[] blockHash,
    long timestamp
) {

    /**
     * 블록 해시 길이.
     */
    public static final int HASH_LENGTH = 32;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException blockHash가 null 이거나 32 byte가 아닌 경우, timestamp가 음수인 경우
     */
    public EntropySnapshot {
        if (blockHash == null || blockHash.length != HASH_LENGTH) {
            throw new IllegalArgumentException("blockHash must be exactly " + HASH_LENGTH + " bytes");
        }
        if (timestamp < 0) {
            throw new IllegalArgumentException("timestamp must be non-negative (current: " + timestamp + ")");
        }
        blockHash = blockHash.clone();
    }

    @Override
    public byte[] blockHash() {
        return blockHash.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntropySnapshot that = (EntropySnapshot) o;
        return timestamp == that.timestamp && Arrays.equals(blockHash, that.blockHash);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(blockHash) + Long.hashCode(timestamp);
    }

    @Override
    public String toString() {
        return "EntropySnapshot{timestamp=" + timestamp + '}';
    }
}
