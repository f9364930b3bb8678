package com.ryuqq.artledger.testkit.contract;

import com.ryuqq.artledger.core.model.Identity;
import com.ryuqq.artledger.core.model.TokenId;
import com.ryuqq.artledger.core.spi.LedgerStore;
import com.ryuqq.artledger.core.spi.LedgerStore.Checkpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Abstract base class for {@link LedgerStore} contract tests.
 *
 * <p>Adapter modules extend this class and supply a fresh store from {@link #createStore()}.</p>
 *
 * <p><strong>Contract Coverage:</strong></p>
 * <ul>
 *   <li>Initial state: no owners, zero balances, no delegates, no operators, next identifier 1</li>
 *   <li>Record round trips for every record family</li>
 *   <li>Rollback restores every record family, including the identifier counter</li>
 *   <li>Nested checkpoints: inner release keeps writes, outer rollback still undoes them</li>
 *   <li>Out-of-order checkpoint closing is rejected</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyStoreContractTest extends AbstractLedgerStoreContractTest {
 *     {@literal @}Override
 *     protected LedgerStore createStore() {
 *         return new MyStore();
 *     }
 * }
 * </pre>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public abstract class AbstractLedgerStoreContractTest {

    protected static final Identity ALICE = Identity.of("0x000000000000000000000000000000000000a11c");
    protected static final Identity BOB = Identity.of("0x0000000000000000000000000000000000000b0b");
    protected static final TokenId TOKEN_1 = TokenId.of(1);
    protected static final TokenId TOKEN_2 = TokenId.of(2);

    protected LedgerStore store;

    /**
     * Creates the store under test. Called before each test.
     *
     * @return an empty store
     */
    protected abstract LedgerStore createStore();

    @BeforeEach
    public void setUpStore() {
        store = createStore();
    }

    @Test
    public void emptyStore_HasDefinedInitialState() {
        assertThat(store.findOwner(TOKEN_1)).isEmpty();
        assertThat(store.getBalance(ALICE)).isZero();
        assertThat(store.findDelegate(TOKEN_1)).isEmpty();
        assertThat(store.isOperator(ALICE, BOB)).isFalse();
        assertThat(store.getNextTokenId()).isEqualTo(TokenId.FIRST);
    }

    @Test
    public void records_ReadBackWhatWasWritten() {
        // When
        store.putOwner(TOKEN_1, ALICE);
        store.putBalance(ALICE, 3);
        store.putDelegate(TOKEN_1, BOB);
        store.putOperator(ALICE, BOB, true);
        store.putNextTokenId(TokenId.of(4));

        // Then
        assertThat(store.findOwner(TOKEN_1)).contains(ALICE);
        assertThat(store.getBalance(ALICE)).isEqualTo(3);
        assertThat(store.findDelegate(TOKEN_1)).contains(BOB);
        assertThat(store.isOperator(ALICE, BOB)).isTrue();
        assertThat(store.isOperator(BOB, ALICE)).isFalse();
        assertThat(store.getNextTokenId()).isEqualTo(TokenId.of(4));
    }

    @Test
    public void putDelegate_NullIdentity_ClearsDelegate() {
        // Given
        store.putDelegate(TOKEN_1, BOB);

        // When
        store.putDelegate(TOKEN_1, Identity.NULL);

        // Then
        assertThat(store.findDelegate(TOKEN_1)).isEmpty();
    }

    @Test
    public void putOperator_False_RevokesApproval() {
        // Given
        store.putOperator(ALICE, BOB, true);

        // When
        store.putOperator(ALICE, BOB, false);

        // Then
        assertThat(store.isOperator(ALICE, BOB)).isFalse();
    }

    @Test
    public void rollback_RestoresEveryRecordFamily() {
        // Given
        store.putOwner(TOKEN_1, ALICE);
        store.putBalance(ALICE, 1);
        store.putNextTokenId(TOKEN_2);

        // When
        Checkpoint checkpoint = store.checkpoint();
        store.putOwner(TOKEN_1, BOB);
        store.putBalance(ALICE, 0);
        store.putBalance(BOB, 1);
        store.putDelegate(TOKEN_1, ALICE);
        store.putOperator(BOB, ALICE, true);
        store.putOwner(TOKEN_2, BOB);
        store.putNextTokenId(TokenId.of(3));
        store.rollback(checkpoint);

        // Then
        assertThat(store.findOwner(TOKEN_1)).contains(ALICE);
        assertThat(store.findOwner(TOKEN_2)).isEmpty();
        assertThat(store.getBalance(ALICE)).isEqualTo(1);
        assertThat(store.getBalance(BOB)).isZero();
        assertThat(store.findDelegate(TOKEN_1)).isEmpty();
        assertThat(store.isOperator(BOB, ALICE)).isFalse();
        assertThat(store.getNextTokenId()).isEqualTo(TOKEN_2);
    }

    @Test
    public void release_KeepsWrites() {
        // When
        Checkpoint checkpoint = store.checkpoint();
        store.putOwner(TOKEN_1, ALICE);
        store.release(checkpoint);

        // Then
        assertThat(store.findOwner(TOKEN_1)).contains(ALICE);
    }

    @Test
    public void outerRollback_UndoesWritesOfReleasedInnerCheckpoint() {
        // Given
        Checkpoint outer = store.checkpoint();
        store.putOwner(TOKEN_1, ALICE);

        Checkpoint inner = store.checkpoint();
        store.putOwner(TOKEN_2, BOB);
        store.release(inner);

        // When
        store.rollback(outer);

        // Then
        assertThat(store.findOwner(TOKEN_1)).isEmpty();
        assertThat(store.findOwner(TOKEN_2)).isEmpty();
    }

    @Test
    public void innerRollback_KeepsOuterWrites() {
        // Given
        Checkpoint outer = store.checkpoint();
        store.putOwner(TOKEN_1, ALICE);

        // When
        Checkpoint inner = store.checkpoint();
        store.putOwner(TOKEN_2, BOB);
        store.rollback(inner);
        store.release(outer);

        // Then
        assertThat(store.findOwner(TOKEN_1)).contains(ALICE);
        assertThat(store.findOwner(TOKEN_2)).isEmpty();
    }

    @Test
    public void closingOuterCheckpointFirst_ThrowsIllegalState() {
        // Given
        Checkpoint outer = store.checkpoint();
        store.checkpoint();

        // When & Then
        assertThatThrownBy(() -> store.release(outer))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void writesAfterCompletedRollback_ArePersistent() {
        // Given
        Checkpoint checkpoint = store.checkpoint();
        store.putOwner(TOKEN_1, ALICE);
        store.rollback(checkpoint);

        // When
        store.putOwner(TOKEN_1, BOB);

        // Then
        assertThat(store.findOwner(TOKEN_1)).contains(BOB);
    }
}
