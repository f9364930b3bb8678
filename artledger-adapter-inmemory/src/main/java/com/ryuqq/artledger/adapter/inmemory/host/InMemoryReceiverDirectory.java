package com.ryuqq.artledger.adapter.inmemory.host;

import com.ryuqq.artledger.core.model.Identity;
import com.ryuqq.artledger.core.spi.ReceiverDirectory;
import com.ryuqq.artledger.core.spi.TokenReceiver;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ReceiverDirectory} SPI.
 *
 * <p>Identities become code-bearing when registered, either with a receiver
 * callback ({@link #register}) or without one ({@link #registerCode}). Everything
 * else is treated as a plain account and skips the receipt check.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public class InMemoryReceiverDirectory implements ReceiverDirectory {

    private final Set<Identity> codeBearing = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<Identity, TokenReceiver> receivers = new ConcurrentHashMap<>();

    /**
     * Deploys code with a receiver callback at {@code identity}.
     *
     * @param identity the code-bearing identity
     * @param receiver its callback
     */
    public void register(Identity identity, TokenReceiver receiver) {
        requireIdentity(identity);
        if (receiver == null) {
            throw new IllegalArgumentException("receiver cannot be null");
        }
        codeBearing.add(identity);
        receivers.put(identity, receiver);
    }

    /**
     * Deploys code without a receiver callback at {@code identity}.
     *
     * @param identity the code-bearing identity
     */
    public void registerCode(Identity identity) {
        requireIdentity(identity);
        codeBearing.add(identity);
        receivers.remove(identity);
    }

    /**
     * Removes any code registered at {@code identity}.
     */
    public void unregister(Identity identity) {
        requireIdentity(identity);
        codeBearing.remove(identity);
        receivers.remove(identity);
    }

    @Override
    public boolean isCodeBearing(Identity identity) {
        requireIdentity(identity);
        return codeBearing.contains(identity);
    }

    @Override
    public Optional<TokenReceiver> findReceiver(Identity identity) {
        requireIdentity(identity);
        return Optional.ofNullable(receivers.get(identity));
    }

    private static void requireIdentity(Identity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
    }
}
