package com.ryuqq.artledger.testkit.receiver;

import com.ryuqq.artledger.core.model.Identity;
import com.ryuqq.artledger.core.model.TokenId;
import com.ryuqq.artledger.core.spi.TokenReceiver;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link TokenReceiver} with scripted behavior that records every call it receives.
 *
 * <pre>
 * ScriptedReceiver accepting = ScriptedReceiver.accepting();
 * ScriptedReceiver wrong = ScriptedReceiver.returning(0xdeadbeef);
 * ScriptedReceiver failing = ScriptedReceiver.failing("no thanks");
 * </pre>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public final class ScriptedReceiver implements TokenReceiver {

    private final Behavior behavior;
    private final List<Receipt> receipts = new CopyOnWriteArrayList<>();

    private ScriptedReceiver(Behavior behavior) {
        this.behavior = behavior;
    }

    /**
     * Receiver returning {@link TokenReceiver#MAGIC_VALUE}.
     */
    public static ScriptedReceiver accepting() {
        return new ScriptedReceiver((operator, tokenId, data) -> MAGIC_VALUE);
    }

    /**
     * Receiver returning a fixed value.
     */
    public static ScriptedReceiver returning(int value) {
        return new ScriptedReceiver((operator, tokenId, data) -> value);
    }

    /**
     * Receiver throwing {@link IllegalStateException} with the given message.
     */
    public static ScriptedReceiver failing(String message) {
        return new ScriptedReceiver((operator, tokenId, data) -> {
            throw new IllegalStateException(message);
        });
    }

    /**
     * Receiver running custom logic, e.g. calling back into the ledger.
     */
    public static ScriptedReceiver of(Behavior behavior) {
        if (behavior == null) {
            throw new IllegalArgumentException("behavior cannot be null");
        }
        return new ScriptedReceiver(behavior);
    }

    @Override
    public int onTokenReceived(Identity operator, TokenId tokenId, byte[] data) {
        receipts.add(new Receipt(operator, tokenId, data.clone()));
        return behavior.onTokenReceived(operator, tokenId, data);
    }

    /**
     * Calls received so far, in order.
     */
    public List<Receipt> receipts() {
        return List.copyOf(receipts);
    }

    /**
     * Scripted callback body.
     */
    @FunctionalInterface
    public interface Behavior {
        int onTokenReceived(Identity operator, TokenId tokenId, byte[] data);
    }

    /**
     * One recorded callback invocation.
     *
     * @param operator the operator passed to the callback
     * @param tokenId the asset passed to the callback
     * @param data the payload passed to the callback
     */
    public record Receipt(Identity operator, TokenId tokenId, byte[] data) {
    }
}
