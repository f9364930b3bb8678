package com.ryuqq.artledger.core.ledger;

import com.ryuqq.artledger.core.error.ErrorCode;
import com.ryuqq.artledger.core.error.LedgerException;
import com.ryuqq.artledger.core.event.Approval;
import com.ryuqq.artledger.core.event.ApprovalForAll;
import com.ryuqq.artledger.core.event.LedgerEvent;
import com.ryuqq.artledger.core.event.Transfer;
import com.ryuqq.artledger.core.hook.NotificationHook;
import com.ryuqq.artledger.core.hook.ReceiptOutcome;
import com.ryuqq.artledger.core.hook.Rejected;
import com.ryuqq.artledger.core.model.Identity;
import com.ryuqq.artledger.core.model.TokenId;
import com.ryuqq.artledger.core.spi.EventSink;
import com.ryuqq.artledger.core.spi.LedgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * 소유권 원장.
 *
 * <p>자산 → 소유자, 소유자 → 잔고, 자산 → 위임자, (소유자, 운영자) → 승인 기록을
 * {@link LedgerStore} 위에서 관리하고 소유권 불변식을 강제합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>[1, next) 범위의 모든 식별자는 null이 아닌 소유자를 가진다</li>
 *   <li>모든 잔고의 합 == next - 1</li>
 *   <li>위임자는 모든 전송에서 해제된다</li>
 * </ul>
 *
 * <p><strong>원자성:</strong> 모든 검증은 변경 이전에 수행됩니다 (check-then-act).
 * 각 변경 연산은 store checkpoint 안에서 실행되며, 실패하면 checkpoint로 롤백되고
 * 해당 호출에서 쌓인 알림도 폐기됩니다. {@code Error}를 포함한 모든 실패가 롤백 대상입니다.
 * 알림은 가장 바깥 호출의 작업이 끝난 뒤, checkpoint를 닫기 전에 {@link EventSink}로
 * 발행됩니다. 발행이 실패하면 변경 전체가 롤백되고 예외가 호출자에게 전파됩니다.</p>
 *
 * <p><strong>재진입:</strong> 안전 전송 중 수신자 콜백이 원장을 다시 호출할 수 있습니다.
 * 중첩 호출의 변경은 바깥 전송의 일부로 취급되어 함께 롤백됩니다.</p>
 *
 * <p>스레드 안전하지 않습니다. 호출 직렬화는 상위 계층 책임입니다.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public final class OwnershipLedger {

    private static final Logger log = LoggerFactory.getLogger(OwnershipLedger.class);

    private static final byte[] EMPTY_PAYLOAD = new byte[0];

    private final LedgerStore store;
    private final EventSink eventSink;
    private final NotificationHook notificationHook;

    private final List<LedgerEvent> pendingEvents = new ArrayList<>();
    private int depth;

    /**
     * 생성자.
     *
     * @param store 원장 저장소
     * @param eventSink 알림 수신자
     * @param notificationHook 안전 전송 훅
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public OwnershipLedger(LedgerStore store, EventSink eventSink, NotificationHook notificationHook) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (eventSink == null) {
            throw new IllegalArgumentException("eventSink cannot be null");
        }
        if (notificationHook == null) {
            throw new IllegalArgumentException("notificationHook cannot be null");
        }
        this.store = store;
        this.eventSink = eventSink;
        this.notificationHook = notificationHook;
    }

    // ============================================================
    // 조회
    // ============================================================

    /**
     * 보유 자산 수.
     *
     * @throws LedgerException INVALID_ADDRESS - owner가 null identity인 경우
     */
    public long balanceOf(Identity owner) {
        require(owner, "owner");
        if (owner.isNull()) {
            throw LedgerException.invalidAddress("Balance query for the null identity");
        }
        return store.getBalance(owner);
    }

    /**
     * 자산 소유자.
     *
     * @throws LedgerException NOT_FOUND - 발행되지 않은 자산
     */
    public Identity ownerOf(TokenId tokenId) {
        return requireOwner(tokenId);
    }

    /**
     * 자산 위임자. 위임자가 없으면 {@link Identity#NULL}.
     *
     * @throws LedgerException NOT_FOUND - 발행되지 않은 자산
     */
    public Identity getApproved(TokenId tokenId) {
        requireOwner(tokenId);
        return store.findDelegate(tokenId).orElse(Identity.NULL);
    }

    /**
     * 운영자 승인 여부.
     *
     * @return 기록이 없으면 false
     */
    public boolean isApprovedForAll(Identity owner, Identity operator) {
        require(owner, "owner");
        require(operator, "operator");
        return store.isOperator(owner, operator);
    }

    /**
     * 발행된 자산 수 (next - 1).
     */
    public long totalSupply() {
        return store.getNextTokenId().getValue() - 1;
    }

    /**
     * 발행 여부. 발행되지 않은 자산에 대해서도 실패하지 않습니다.
     */
    public boolean exists(TokenId tokenId) {
        require(tokenId, "tokenId");
        return store.findOwner(tokenId).isPresent();
    }

    // ============================================================
    // 변경
    // ============================================================

    /**
     * 새 자산 발행.
     *
     * <p>다음 식별자를 할당하고 caller를 소유자로 기록한 뒤 Transfer(NULL → caller)를 발행합니다.</p>
     *
     * @param caller 호출자 (새 소유자)
     * @return 할당된 식별자
     * @throws LedgerException INVALID_ADDRESS - caller가 null identity인 경우
     */
    public TokenId mint(Identity caller) {
        require(caller, "caller");
        return atomically(() -> {
            if (caller.isNull()) {
                throw LedgerException.invalidAddress("Cannot mint to the null identity");
            }
            TokenId tokenId = store.getNextTokenId();
            store.putOwner(tokenId, caller);
            store.putBalance(caller, store.getBalance(caller) + 1);
            store.putNextTokenId(tokenId.next());
            emit(new Transfer(Identity.NULL, caller, tokenId));
            log.info("Minted {} to {}", tokenId, caller);
            return tokenId;
        });
    }

    /**
     * 단일 자산 위임자 지정. {@link Identity#NULL}을 지정하면 위임이 해제됩니다.
     *
     * @throws LedgerException NOT_FOUND, INVALID_APPROVAL (to == 소유자), UNAUTHORIZED
     */
    public void approve(Identity caller, Identity to, TokenId tokenId) {
        require(caller, "caller");
        require(to, "to");
        atomically(() -> {
            Identity owner = requireOwner(tokenId);
            if (to.equals(owner)) {
                throw LedgerException.invalidApproval("Approval to the current owner of " + tokenId);
            }
            if (!caller.equals(owner) && !store.isOperator(owner, caller)) {
                throw LedgerException.unauthorized(caller + " is neither owner nor operator of " + tokenId);
            }
            store.putDelegate(tokenId, to);
            emit(new Approval(owner, to, tokenId));
            log.info("Approved {} for {} by {}", to, tokenId, caller);
            return null;
        });
    }

    /**
     * 운영자 승인 설정/해제.
     *
     * @throws LedgerException INVALID_APPROVAL - operator == caller
     */
    public void setApprovalForAll(Identity caller, Identity operator, boolean approved) {
        require(caller, "caller");
        require(operator, "operator");
        atomically(() -> {
            if (operator.equals(caller)) {
                throw LedgerException.invalidApproval(caller + " cannot set operator approval for itself");
            }
            store.putOperator(caller, operator, approved);
            emit(new ApprovalForAll(caller, operator, approved));
            log.info("Operator {} {} for {}", operator, approved ? "approved" : "revoked", caller);
            return null;
        });
    }

    /**
     * 자산 전송.
     *
     * <p><strong>검증 순서:</strong></p>
     * <ol>
     *   <li>NOT_FOUND - 발행되지 않은 자산</li>
     *   <li>UNAUTHORIZED - caller가 소유자/위임자/운영자가 아님</li>
     *   <li>OWNERSHIP_MISMATCH - 기록된 소유자 != from</li>
     *   <li>INVALID_ADDRESS - to가 null identity</li>
     * </ol>
     */
    public void transferFrom(Identity caller, Identity from, Identity to, TokenId tokenId) {
        requireTransferArguments(caller, from, to, tokenId);
        atomically(() -> {
            transfer(caller, from, to, tokenId);
            return null;
        });
    }

    /**
     * 빈 payload로 안전 전송.
     *
     * @see #safeTransferFrom(Identity, Identity, Identity, TokenId, byte[])
     */
    public void safeTransferFrom(Identity caller, Identity from, Identity to, TokenId tokenId) {
        safeTransferFrom(caller, from, to, tokenId, EMPTY_PAYLOAD);
    }

    /**
     * 안전 전송.
     *
     * <p>{@link #transferFrom}과 동일하게 전송한 뒤 수신자에게 통지합니다.
     * 수신자가 거부하면 전송 전체가 롤백되고 RECEIVER_REJECTED가 발생합니다.</p>
     *
     * @param data 수신자 콜백에 전달할 payload
     */
    public void safeTransferFrom(Identity caller, Identity from, Identity to, TokenId tokenId, byte[] data) {
        requireTransferArguments(caller, from, to, tokenId);
        require(data, "data");
        atomically(() -> {
            transfer(caller, from, to, tokenId);
            ReceiptOutcome outcome = notificationHook.notify(caller, to, tokenId, data);
            if (outcome instanceof Rejected rejected) {
                log.warn("Safe transfer of {} to {} reverted: {}", tokenId, to, rejected.reason());
                throw new LedgerException(
                    ErrorCode.RECEIVER_REJECTED,
                    rejected.reason(),
                    rejected.cause()
                );
            }
            return null;
        });
    }

    // ============================================================
    // 내부
    // ============================================================

    private void transfer(Identity caller, Identity from, Identity to, TokenId tokenId) {
        Identity owner = requireOwner(tokenId);
        if (!isAuthorized(caller, owner, tokenId)) {
            throw LedgerException.unauthorized(caller + " is not authorized to transfer " + tokenId);
        }
        if (!owner.equals(from)) {
            throw LedgerException.ownershipMismatch(tokenId + " is owned by " + owner + ", not " + from);
        }
        if (to.isNull()) {
            throw LedgerException.invalidAddress("Cannot transfer " + tokenId + " to the null identity");
        }

        store.putDelegate(tokenId, Identity.NULL);
        store.putBalance(from, store.getBalance(from) - 1);
        store.putBalance(to, store.getBalance(to) + 1);
        store.putOwner(tokenId, to);
        emit(new Transfer(from, to, tokenId));
        log.info("Transferred {} from {} to {} by {}", tokenId, from, to, caller);
    }

    private boolean isAuthorized(Identity caller, Identity owner, TokenId tokenId) {
        if (caller.equals(owner)) {
            return true;
        }
        if (store.findDelegate(tokenId).map(caller::equals).orElse(false)) {
            return true;
        }
        return store.isOperator(owner, caller);
    }

    private Identity requireOwner(TokenId tokenId) {
        require(tokenId, "tokenId");
        return store.findOwner(tokenId)
            .orElseThrow(() -> LedgerException.notFound(tokenId + " has not been minted"));
    }

    private <T> T atomically(Supplier<T> action) {
        LedgerStore.Checkpoint checkpoint = store.checkpoint();
        int mark = pendingEvents.size();
        depth++;
        try {
            T result = action.get();
            if (depth == 1) {
                publishPending();
            }
            store.release(checkpoint);
            return result;
        } catch (RuntimeException | Error e) {
            store.rollback(checkpoint);
            pendingEvents.subList(mark, pendingEvents.size()).clear();
            throw e;
        } finally {
            depth--;
        }
    }

    private void emit(LedgerEvent event) {
        pendingEvents.add(event);
    }

    // 가장 바깥 checkpoint가 열린 상태에서 발행: sink 실패는 호출 전체를 롤백시킨다
    private void publishPending() {
        for (LedgerEvent event : pendingEvents) {
            eventSink.publish(event);
        }
        pendingEvents.clear();
    }

    private static void requireTransferArguments(Identity caller, Identity from, Identity to, TokenId tokenId) {
        require(caller, "caller");
        require(from, "from");
        require(to, "to");
        require(tokenId, "tokenId");
    }

    private static void require(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
