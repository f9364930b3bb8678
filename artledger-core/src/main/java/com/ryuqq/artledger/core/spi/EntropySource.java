package com.ryuqq.artledger.core.spi;

import com.ryuqq.artledger.core.model.EntropySnapshot;

/**
 * Ambient entropy supplied by the execution host.
 *
 * <p>Each call returns the host's current view of the most recent block hash and
 * timestamp. The value changes as the host advances, so metadata derived from it
 * is reproducible only while the snapshot stays the same.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EntropySource {

    /**
     * Returns the current entropy snapshot.
     *
     * @return the snapshot, never null
     */
    EntropySnapshot current();
}
