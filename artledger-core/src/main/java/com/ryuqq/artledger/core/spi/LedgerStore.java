package com.ryuqq.artledger.core.spi;

import com.ryuqq.artledger.core.model.Identity;
import com.ryuqq.artledger.core.model.TokenId;

import java.util.Optional;

/**
 * Atomic key-value storage SPI backing the ownership ledger.
 *
 * <p>The store holds five record families and nothing else:</p>
 * <ul>
 *   <li>asset → owner</li>
 *   <li>identity → balance (default 0)</li>
 *   <li>asset → delegate (absent means no delegate)</li>
 *   <li>(owner, operator) → approved flag (default false)</li>
 *   <li>next identifier to assign (initially 1)</li>
 * </ul>
 *
 * <p>The store performs no validation of ledger rules. Authorization, existence
 * and ownership checks belong to {@link com.ryuqq.artledger.core.ledger.OwnershipLedger}.</p>
 *
 * <p><strong>Checkpoint / Rollback:</strong></p>
 * <pre>
 * Checkpoint cp = store.checkpoint();
 * try {
 *     store.putOwner(id, to);
 *     ...
 *     store.release(cp);   // keep the writes
 * } catch (RuntimeException e) {
 *     store.rollback(cp);  // every write since cp is undone
 *     throw e;
 * }
 * </pre>
 *
 * <p>Checkpoints nest. Writes made after an inner checkpoint are undone by a
 * rollback to any enclosing checkpoint, even when the inner one was released.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Readers never observe a partially applied call (the caller serializes access)</li>
 *   <li>rollback restores every record family, including the identifier counter</li>
 * </ul>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public interface LedgerStore {

    /**
     * Finds the recorded owner of an asset.
     *
     * @param tokenId the asset identifier
     * @return the owner, or empty if the asset was never minted
     */
    Optional<Identity> findOwner(TokenId tokenId);

    /**
     * Records the owner of an asset.
     *
     * @param tokenId the asset identifier
     * @param owner the new owner (never {@link Identity#NULL})
     */
    void putOwner(TokenId tokenId, Identity owner);

    /**
     * Returns the number of assets held by an identity.
     *
     * @param owner the identity
     * @return the balance, 0 if none recorded
     */
    long getBalance(Identity owner);

    /**
     * Records the balance of an identity.
     *
     * @param owner the identity
     * @param balance the new balance (non-negative)
     */
    void putBalance(Identity owner, long balance);

    /**
     * Finds the delegate of an asset.
     *
     * @param tokenId the asset identifier
     * @return the delegate, or empty if none is set
     */
    Optional<Identity> findDelegate(TokenId tokenId);

    /**
     * Sets or clears the delegate of an asset.
     *
     * @param tokenId the asset identifier
     * @param delegate the delegate; {@link Identity#NULL} clears the record
     */
    void putDelegate(TokenId tokenId, Identity delegate);

    /**
     * Returns whether {@code operator} may act on all assets of {@code owner}.
     *
     * @param owner the owner
     * @param operator the operator
     * @return the stored flag, false if none recorded
     */
    boolean isOperator(Identity owner, Identity operator);

    /**
     * Records an operator approval flag.
     *
     * @param owner the owner
     * @param operator the operator
     * @param approved the flag
     */
    void putOperator(Identity owner, Identity operator, boolean approved);

    /**
     * Returns the next identifier to be assigned by mint.
     *
     * @return the next identifier (1 for an empty store)
     */
    TokenId getNextTokenId();

    /**
     * Records the next identifier to be assigned.
     *
     * @param next the next identifier
     */
    void putNextTokenId(TokenId next);

    /**
     * Opens a checkpoint that later writes can be rolled back to.
     *
     * @return the checkpoint handle
     */
    Checkpoint checkpoint();

    /**
     * Closes a checkpoint, keeping every write made since it was opened.
     *
     * @param checkpoint a checkpoint returned by {@link #checkpoint()}
     * @throws IllegalStateException if the checkpoint is not the innermost open one
     */
    void release(Checkpoint checkpoint);

    /**
     * Undoes every write made since the checkpoint was opened, then closes it.
     *
     * @param checkpoint a checkpoint returned by {@link #checkpoint()}
     * @throws IllegalStateException if the checkpoint is not the innermost open one
     */
    void rollback(Checkpoint checkpoint);

    /**
     * Opaque checkpoint handle.
     *
     * @param depth nesting depth at which the checkpoint was opened (1 = outermost)
     * @param position implementation-defined journal position
     */
    record Checkpoint(int depth, long position) {

        public Checkpoint {
            if (depth <= 0) {
                throw new IllegalArgumentException("depth must be positive (current: " + depth + ")");
            }
            if (position < 0) {
                throw new IllegalArgumentException("position must be non-negative (current: " + position + ")");
            }
        }
    }
}
