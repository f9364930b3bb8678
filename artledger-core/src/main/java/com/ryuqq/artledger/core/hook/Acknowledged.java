package com.ryuqq.artledger.core.hook;

/**
 * 수신자가 magic value를 반환한 결과.
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public record Acknowledged() implements ReceiptOutcome {
}
