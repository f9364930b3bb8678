/**
 * Ledger failure types.
 *
 * <p>Every domain failure is a {@link com.ryuqq.artledger.core.error.LedgerException}
 * tagged with an {@link com.ryuqq.artledger.core.error.ErrorCode}. Argument misuse
 * (null values, out-of-range inputs) is reported with {@link IllegalArgumentException}
 * instead, and never reaches the ledger.</p>
 *
 * @since 1.0.0
 * @author ArtLedger Team
 */
package com.ryuqq.artledger.core.error;
