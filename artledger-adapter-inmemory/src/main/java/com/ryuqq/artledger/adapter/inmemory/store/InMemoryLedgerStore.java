package com.ryuqq.artledger.adapter.inmemory.store;

import com.ryuqq.artledger.core.model.Identity;
import com.ryuqq.artledger.core.model.TokenId;
import com.ryuqq.artledger.core.spi.LedgerStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link LedgerStore} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>owners:</strong> ConcurrentHashMap&lt;TokenId, Identity&gt; - asset owner records</li>
 *   <li><strong>balances:</strong> ConcurrentHashMap&lt;Identity, Long&gt; - non-zero balances only</li>
 *   <li><strong>delegates:</strong> ConcurrentHashMap&lt;TokenId, Identity&gt; - present only while a delegate is set</li>
 *   <li><strong>operators:</strong> ConcurrentHashMap&lt;OperatorKey, Boolean&gt; - true flags only</li>
 *   <li><strong>undoJournal:</strong> ArrayList&lt;Runnable&gt; - inverse of every write made while a checkpoint is open</li>
 * </ul>
 *
 * <p><strong>Checkpoint Semantics:</strong></p>
 * <ul>
 *   <li>checkpoint() pushes the current journal position</li>
 *   <li>rollback() replays the journal backwards down to that position</li>
 *   <li>release() of the outermost checkpoint discards the journal</li>
 *   <li>Writes outside any checkpoint are not journaled</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Checkpoints are not thread-confined; callers must serialize writers</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * LedgerStore store = new InMemoryLedgerStore();
 * Checkpoint cp = store.checkpoint();
 * store.putOwner(TokenId.of(1), alice);
 * store.rollback(cp);
 * store.findOwner(TokenId.of(1)); // Optional.empty()
 * </pre>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final ConcurrentHashMap<TokenId, Identity> owners;
    private final ConcurrentHashMap<Identity, Long> balances;
    private final ConcurrentHashMap<TokenId, Identity> delegates;
    private final ConcurrentHashMap<OperatorKey, Boolean> operators;

    private volatile TokenId nextTokenId;

    private final List<Runnable> undoJournal;
    private final Deque<Checkpoint> openCheckpoints;

    /**
     * Creates a new InMemoryLedgerStore with empty storage (next identifier = 1).
     */
    public InMemoryLedgerStore() {
        this.owners = new ConcurrentHashMap<>();
        this.balances = new ConcurrentHashMap<>();
        this.delegates = new ConcurrentHashMap<>();
        this.operators = new ConcurrentHashMap<>();
        this.nextTokenId = TokenId.FIRST;
        this.undoJournal = new ArrayList<>();
        this.openCheckpoints = new ArrayDeque<>();
    }

    @Override
    public Optional<Identity> findOwner(TokenId tokenId) {
        requireNonNull(tokenId, "tokenId");
        return Optional.ofNullable(owners.get(tokenId));
    }

    @Override
    public synchronized void putOwner(TokenId tokenId, Identity owner) {
        requireNonNull(tokenId, "tokenId");
        requireNonNull(owner, "owner");
        if (owner.isNull()) {
            throw new IllegalArgumentException("owner cannot be the null identity");
        }
        journal(owners, tokenId, owners.put(tokenId, owner));
    }

    @Override
    public long getBalance(Identity owner) {
        requireNonNull(owner, "owner");
        return balances.getOrDefault(owner, 0L);
    }

    @Override
    public synchronized void putBalance(Identity owner, long balance) {
        requireNonNull(owner, "owner");
        if (balance < 0) {
            throw new IllegalArgumentException("balance must be non-negative, but was: " + balance);
        }
        Long previous = balance == 0 ? balances.remove(owner) : balances.put(owner, balance);
        journal(balances, owner, previous);
    }

    @Override
    public Optional<Identity> findDelegate(TokenId tokenId) {
        requireNonNull(tokenId, "tokenId");
        return Optional.ofNullable(delegates.get(tokenId));
    }

    @Override
    public synchronized void putDelegate(TokenId tokenId, Identity delegate) {
        requireNonNull(tokenId, "tokenId");
        requireNonNull(delegate, "delegate");
        Identity previous = delegate.isNull() ? delegates.remove(tokenId) : delegates.put(tokenId, delegate);
        journal(delegates, tokenId, previous);
    }

    @Override
    public boolean isOperator(Identity owner, Identity operator) {
        requireNonNull(owner, "owner");
        requireNonNull(operator, "operator");
        return operators.getOrDefault(new OperatorKey(owner, operator), Boolean.FALSE);
    }

    @Override
    public synchronized void putOperator(Identity owner, Identity operator, boolean approved) {
        requireNonNull(owner, "owner");
        requireNonNull(operator, "operator");
        OperatorKey key = new OperatorKey(owner, operator);
        Boolean previous = approved ? operators.put(key, Boolean.TRUE) : operators.remove(key);
        journal(operators, key, previous);
    }

    @Override
    public TokenId getNextTokenId() {
        return nextTokenId;
    }

    @Override
    public synchronized void putNextTokenId(TokenId next) {
        requireNonNull(next, "next");
        if (next.getValue() < 1) {
            throw new IllegalArgumentException("next identifier must be at least 1, but was: " + next.getValue());
        }
        TokenId previous = nextTokenId;
        nextTokenId = next;
        if (!openCheckpoints.isEmpty()) {
            undoJournal.add(() -> nextTokenId = previous);
        }
    }

    @Override
    public synchronized Checkpoint checkpoint() {
        Checkpoint checkpoint = new Checkpoint(openCheckpoints.size() + 1, undoJournal.size());
        openCheckpoints.push(checkpoint);
        return checkpoint;
    }

    @Override
    public synchronized void release(Checkpoint checkpoint) {
        close(checkpoint);
        if (openCheckpoints.isEmpty()) {
            undoJournal.clear();
        }
    }

    @Override
    public synchronized void rollback(Checkpoint checkpoint) {
        close(checkpoint);
        for (int i = undoJournal.size() - 1; i >= checkpoint.position(); i--) {
            undoJournal.remove(i).run();
        }
        if (openCheckpoints.isEmpty()) {
            undoJournal.clear();
        }
    }

    /**
     * Returns a snapshot of all owner records.
     *
     * @return immutable copy of asset → owner
     */
    public Map<TokenId, Identity> owners() {
        return Map.copyOf(owners);
    }

    /**
     * Returns a snapshot of all non-zero balances.
     *
     * @return immutable copy of identity → balance
     */
    public Map<Identity, Long> balances() {
        return Map.copyOf(balances);
    }

    /**
     * Clears all records (for testing).
     *
     * @throws IllegalStateException if a checkpoint is open
     */
    public synchronized void clear() {
        if (!openCheckpoints.isEmpty()) {
            throw new IllegalStateException("Cannot clear while " + openCheckpoints.size() + " checkpoint(s) are open");
        }
        owners.clear();
        balances.clear();
        delegates.clear();
        operators.clear();
        nextTokenId = TokenId.FIRST;
    }

    private void close(Checkpoint checkpoint) {
        requireNonNull(checkpoint, "checkpoint");
        Checkpoint innermost = openCheckpoints.peek();
        if (!checkpoint.equals(innermost)) {
            throw new IllegalStateException("Checkpoint " + checkpoint + " is not the innermost open checkpoint: " + innermost);
        }
        openCheckpoints.pop();
    }

    private <K, V> void journal(Map<K, V> map, K key, V previous) {
        if (openCheckpoints.isEmpty()) {
            return;
        }
        if (previous == null) {
            undoJournal.add(() -> map.remove(key));
        } else {
            undoJournal.add(() -> map.put(key, previous));
        }
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }

    private record OperatorKey(Identity owner, Identity operator) {
    }
}
