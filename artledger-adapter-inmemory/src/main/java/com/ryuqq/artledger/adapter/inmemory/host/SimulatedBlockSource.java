package com.ryuqq.artledger.adapter.inmemory.host;

import com.ryuqq.artledger.core.model.EntropySnapshot;
import com.ryuqq.artledger.core.spi.EntropySource;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic {@link EntropySource} that simulates a chain of blocks.
 *
 * <p>Block {@code n} has hash {@code SHA-256(genesisLabel || n)} and timestamp
 * {@code genesisTimestamp + n * blockIntervalSeconds}. The snapshot stays the same
 * until {@link #advance()} is called, so repeated metadata queries within one block
 * are reproducible and queries across blocks are not.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public class SimulatedBlockSource implements EntropySource {

    private static final String DEFAULT_LABEL = "artledger-genesis";
    private static final long DEFAULT_GENESIS_TIMESTAMP = 1_700_000_000L;
    private static final long DEFAULT_BLOCK_INTERVAL_SECONDS = 12L;

    private final byte[] label;
    private final long genesisTimestamp;
    private final long blockIntervalSeconds;

    private volatile long blockNumber;

    /**
     * Creates a block source with the default genesis label, timestamp and 12 second interval.
     */
    public SimulatedBlockSource() {
        this(DEFAULT_LABEL, DEFAULT_GENESIS_TIMESTAMP, DEFAULT_BLOCK_INTERVAL_SECONDS);
    }

    /**
     * Creates a block source.
     *
     * @param genesisLabel label mixed into every block hash
     * @param genesisTimestamp timestamp of block 0 (seconds)
     * @param blockIntervalSeconds seconds between consecutive blocks
     * @throws IllegalArgumentException if the label is blank, the timestamp negative or the interval not positive
     */
    public SimulatedBlockSource(String genesisLabel, long genesisTimestamp, long blockIntervalSeconds) {
        if (genesisLabel == null || genesisLabel.isBlank()) {
            throw new IllegalArgumentException("genesisLabel cannot be null or blank");
        }
        if (genesisTimestamp < 0) {
            throw new IllegalArgumentException("genesisTimestamp must be non-negative, but was: " + genesisTimestamp);
        }
        if (blockIntervalSeconds <= 0) {
            throw new IllegalArgumentException("blockIntervalSeconds must be positive, but was: " + blockIntervalSeconds);
        }
        this.label = genesisLabel.getBytes(StandardCharsets.UTF_8);
        this.genesisTimestamp = genesisTimestamp;
        this.blockIntervalSeconds = blockIntervalSeconds;
    }

    @Override
    public EntropySnapshot current() {
        long block = blockNumber;
        return new EntropySnapshot(blockHash(block), genesisTimestamp + block * blockIntervalSeconds);
    }

    /**
     * Moves to the next block.
     *
     * @return the new block number
     */
    public synchronized long advance() {
        blockNumber++;
        return blockNumber;
    }

    public long blockNumber() {
        return blockNumber;
    }

    private byte[] blockHash(long block) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(label);
            digest.update(ByteBuffer.allocate(Long.BYTES).putLong(block).array());
            return digest.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
