package com.ryuqq.artledger.core.spi;

import com.ryuqq.artledger.core.model.Identity;
import com.ryuqq.artledger.core.model.TokenId;

/**
 * Callback exposed by a code-bearing recipient of a safe transfer.
 *
 * <p>The recipient confirms it understands the receipt protocol by returning
 * {@link #MAGIC_VALUE}. Any other return value, or any exception, rejects the
 * transfer and the whole transfer is reverted.</p>
 *
 * <p>The callback runs synchronously inside the transfer. It may call back into
 * the ledger; such nested calls are reverted together with the transfer when it
 * is rejected.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TokenReceiver {

    /**
     * 4-byte acknowledgement value ({@code 0x150b7a02}).
     */
    int MAGIC_VALUE = 0x150b7a02;

    /**
     * Notifies the recipient that it now owns {@code tokenId}.
     *
     * @param operator the identity that initiated the transfer
     * @param tokenId the transferred asset
     * @param data opaque payload (empty for the plain safe transfer)
     * @return {@link #MAGIC_VALUE} to accept the asset
     */
    int onTokenReceived(Identity operator, TokenId tokenId, byte[] data);
}
