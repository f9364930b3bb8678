package com.ryuqq.artledger.core.hook;

/**
 * 수신 거부.
 *
 * @param reason 거부 사유
 * @param cause 콜백이 던진 예외 (선택, null 가능)
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public record Rejected(
    String reason,
    Throwable cause
) implements ReceiptOutcome {

    public Rejected {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }

    public static Rejected of(String reason) {
        return new Rejected(reason, null);
    }
}
