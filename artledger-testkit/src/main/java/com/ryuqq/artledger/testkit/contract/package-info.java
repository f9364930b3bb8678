/**
 * Reusable SPI contract tests.
 *
 * <p>Adapter modules extend these base classes to prove that their implementations honor
 * the {@link com.ryuqq.artledger.core.spi.LedgerStore} contract, in particular the
 * checkpoint and rollback guarantees that make ledger calls atomic.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
package com.ryuqq.artledger.testkit.contract;
