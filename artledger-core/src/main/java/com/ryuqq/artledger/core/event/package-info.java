/**
 * Ledger notifications: {@code Transfer}, {@code Approval}, {@code ApprovalForAll}.
 *
 * <p>A mint is a {@code Transfer} whose {@code from} is the null identity.</p>
 *
 * @since 1.0.0
 * @author ArtLedger Team
 */
package com.ryuqq.artledger.core.event;
