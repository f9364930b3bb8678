/**
 * In-memory implementation of the ledger Store SPI.
 *
 * <p>This package provides {@link com.ryuqq.artledger.adapter.inmemory.store.InMemoryLedgerStore},
 * a journaled key-value store suitable for tests, local development and as a reference
 * for persistent adapters.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
package com.ryuqq.artledger.adapter.inmemory.store;
