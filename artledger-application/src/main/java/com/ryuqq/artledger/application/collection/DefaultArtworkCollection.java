package com.ryuqq.artledger.application.collection;

import com.ryuqq.artledger.core.config.CollectionConfig;
import com.ryuqq.artledger.core.error.LedgerException;
import com.ryuqq.artledger.core.hook.NotificationHook;
import com.ryuqq.artledger.core.ledger.OwnershipLedger;
import com.ryuqq.artledger.core.metadata.MetadataEngine;
import com.ryuqq.artledger.core.model.Identity;
import com.ryuqq.artledger.core.model.TokenId;
import com.ryuqq.artledger.core.spi.EntropySource;
import com.ryuqq.artledger.core.spi.EventSink;
import com.ryuqq.artledger.core.spi.LedgerStore;
import com.ryuqq.artledger.core.spi.ReceiverDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * {@link ArtworkCollection} 기본 구현.
 *
 * <p>{@link OwnershipLedger}와 {@link MetadataEngine}을 하나의 직렬화 지점 뒤에 묶습니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>변경 연산은 write lock 아래에서 한 번에 하나씩 실행</li>
 *   <li>조회 연산과 tokenURI는 read lock 아래에서 실행되어 진행 중인 변경을 보지 않음</li>
 *   <li>수신자 콜백은 write lock을 보유한 스레드에서 실행되므로 재진입 가능</li>
 * </ul>
 *
 * <p><strong>생성 예시:</strong></p>
 * <pre>
 * ArtworkCollection collection = new DefaultArtworkCollection(
 *     new CollectionConfig(),
 *     new InMemoryLedgerStore(),
 *     new InMemoryEventLog(),
 *     new SimulatedBlockSource(),
 *     new InMemoryReceiverDirectory()
 * );
 * </pre>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public final class DefaultArtworkCollection implements ArtworkCollection {

    private static final Logger log = LoggerFactory.getLogger(DefaultArtworkCollection.class);

    private final CollectionConfig config;
    private final OwnershipLedger ledger;
    private final MetadataEngine metadataEngine;

    private final Lock readLock;
    private final Lock writeLock;

    /**
     * 생성자.
     *
     * @param config 컬렉션 설정
     * @param store 원장 저장소
     * @param eventSink 알림 수신자
     * @param entropySource 호스트 엔트로피
     * @param receiverDirectory 코드 존재 여부 조회
     * @throws IllegalArgumentException 의존성이 null이거나 설정의 해시 알고리즘을 사용할 수 없는 경우
     */
    public DefaultArtworkCollection(
        CollectionConfig config,
        LedgerStore store,
        EventSink eventSink,
        EntropySource entropySource,
        ReceiverDirectory receiverDirectory
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.ledger = new OwnershipLedger(store, eventSink, new NotificationHook(receiverDirectory));
        this.metadataEngine = new MetadataEngine(config, entropySource);

        ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        this.readLock = lock.readLock();
        this.writeLock = lock.writeLock();

        log.info("ArtworkCollection '{}' ({}) initialized at {} with digest {}",
            config.name(), config.symbol(), config.ledgerIdentity(), config.digestAlgorithm());
    }

    @Override
    public String name() {
        return config.name();
    }

    @Override
    public String symbol() {
        return config.symbol();
    }

    @Override
    public TokenId mint(Identity caller) {
        return write("mint", () -> ledger.mint(caller));
    }

    @Override
    public long balanceOf(Identity owner) {
        return read(() -> ledger.balanceOf(owner));
    }

    @Override
    public Identity ownerOf(TokenId tokenId) {
        return read(() -> ledger.ownerOf(tokenId));
    }

    @Override
    public Identity getApproved(TokenId tokenId) {
        return read(() -> ledger.getApproved(tokenId));
    }

    @Override
    public boolean isApprovedForAll(Identity owner, Identity operator) {
        return read(() -> ledger.isApprovedForAll(owner, operator));
    }

    @Override
    public void approve(Identity caller, Identity to, TokenId tokenId) {
        write("approve", () -> {
            ledger.approve(caller, to, tokenId);
            return null;
        });
    }

    @Override
    public void setApprovalForAll(Identity caller, Identity operator, boolean approved) {
        write("setApprovalForAll", () -> {
            ledger.setApprovalForAll(caller, operator, approved);
            return null;
        });
    }

    @Override
    public void transferFrom(Identity caller, Identity from, Identity to, TokenId tokenId) {
        write("transferFrom", () -> {
            ledger.transferFrom(caller, from, to, tokenId);
            return null;
        });
    }

    @Override
    public void safeTransferFrom(Identity caller, Identity from, Identity to, TokenId tokenId) {
        write("safeTransferFrom", () -> {
            ledger.safeTransferFrom(caller, from, to, tokenId);
            return null;
        });
    }

    @Override
    public void safeTransferFrom(Identity caller, Identity from, Identity to, TokenId tokenId, byte[] data) {
        write("safeTransferFrom", () -> {
            ledger.safeTransferFrom(caller, from, to, tokenId, data);
            return null;
        });
    }

    @Override
    public String tokenURI(TokenId tokenId) {
        return read(() -> {
            ledger.ownerOf(tokenId);
            return metadataEngine.tokenUri(tokenId);
        });
    }

    @Override
    public long totalSupply() {
        return read(ledger::totalSupply);
    }

    @Override
    public boolean exists(TokenId tokenId) {
        return read(() -> ledger.exists(tokenId));
    }

    private <T> T read(Supplier<T> query) {
        readLock.lock();
        try {
            return query.get();
        } finally {
            readLock.unlock();
        }
    }

    private <T> T write(String operation, Supplier<T> mutation) {
        writeLock.lock();
        try {
            return mutation.get();
        } catch (LedgerException e) {
            log.debug("{} failed: {}", operation, e.getMessage());
            throw e;
        } finally {
            writeLock.unlock();
        }
    }
}
