package com.ryuqq.artledger.core.hook;

/**
 * 수신자가 코드를 갖지 않아 확인을 생략한 결과.
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public record Skipped() implements ReceiptOutcome {
}
