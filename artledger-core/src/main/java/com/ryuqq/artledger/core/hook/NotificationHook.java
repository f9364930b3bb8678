package com.ryuqq.artledger.core.hook;

import com.ryuqq.artledger.core.model.Identity;
import com.ryuqq.artledger.core.model.TokenId;
import com.ryuqq.artledger.core.spi.ReceiverDirectory;
import com.ryuqq.artledger.core.spi.TokenReceiver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 안전 전송 수신 확인 훅.
 *
 * <p><strong>판정 규칙:</strong></p>
 * <pre>
 * 수신자가 code-bearing이 아님      → Skipped
 * 콜백 없음                         → Rejected
 * 콜백 예외                         → Rejected (cause 포함)
 * 반환값 != TokenReceiver.MAGIC_VALUE → Rejected
 * 반환값 == MAGIC_VALUE             → Acknowledged
 * </pre>
 *
 * <p>콜백은 동기적으로 끝까지 실행된 뒤에 제어가 돌아옵니다. 콜백이 던진 {@link Error}는
 * 결과로 변환하지 않고 그대로 전파되며, 원장이 호출 전체를 롤백합니다.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public final class NotificationHook {

    private static final Logger log = LoggerFactory.getLogger(NotificationHook.class);

    private final ReceiverDirectory directory;

    public NotificationHook(ReceiverDirectory directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        this.directory = directory;
    }

    /**
     * 수신자에게 자산 수령을 통지하고 확인 결과를 반환.
     *
     * @param operator 전송을 실행한 identity
     * @param recipient 수신자
     * @param tokenId 자산 식별자
     * @param data 콜백에 전달할 payload
     * @return 확인 결과
     */
    public ReceiptOutcome notify(Identity operator, Identity recipient, TokenId tokenId, byte[] data) {
        if (operator == null || recipient == null || tokenId == null || data == null) {
            throw new IllegalArgumentException("operator, recipient, tokenId and data cannot be null");
        }
        if (!directory.isCodeBearing(recipient)) {
            return new Skipped();
        }

        Optional<TokenReceiver> receiver = directory.findReceiver(recipient);
        if (receiver.isEmpty()) {
            return Rejected.of("Recipient " + recipient + " exposes no receiver callback");
        }

        int returned;
        try {
            returned = receiver.get().onTokenReceived(operator, tokenId, data.clone());
        } catch (RuntimeException e) {
            log.warn("Receiver callback of {} failed for {}", recipient, tokenId, e);
            return new Rejected("Receiver callback failed: " + e.getMessage(), e);
        }

        if (returned != TokenReceiver.MAGIC_VALUE) {
            return Rejected.of(String.format("Recipient %s returned 0x%08x instead of 0x%08x",
                recipient, returned, TokenReceiver.MAGIC_VALUE));
        }
        return new Acknowledged();
    }
}
