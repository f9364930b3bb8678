package com.ryuqq.artledger.core.spi;

import com.ryuqq.artledger.core.model.Identity;

import java.util.Optional;

/**
 * Host capability answering code-presence questions about identities.
 *
 * <p>An identity is code-bearing when the execution host runs code on its behalf.
 * Only code-bearing recipients are asked to acknowledge a safe transfer.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public interface ReceiverDirectory {

    /**
     * Returns whether code is deployed at {@code identity}.
     *
     * @param identity the identity to inspect
     * @return true if the identity is code-bearing
     */
    boolean isCodeBearing(Identity identity);

    /**
     * Looks up the receiver callback of a code-bearing identity.
     *
     * @param identity the identity
     * @return the callback, or empty if the code exposes none
     */
    Optional<TokenReceiver> findReceiver(Identity identity);
}
