package com.ryuqq.artledger.core.error;

/**
 * 원장 연산 실패.
 *
 * <p>검증 단계에서 발생하면 어떤 변경도 일어나기 전이며, 안전 전송 거부 시에는
 * 이미 적용된 변경이 모두 되돌려진 뒤에 전파됩니다.</p>
 *
 * <pre>
 * try {
 *     ledger.transferFrom(caller, from, to, tokenId);
 * } catch (LedgerException e) {
 *     if (e.errorCode() == ErrorCode.UNAUTHORIZED) { ... }
 * }
 * </pre>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public class LedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    /**
     * 생성자.
     *
     * @param errorCode 실패 종류
     * @param message 오류 메시지
     * @throws IllegalArgumentException errorCode가 null인 경우
     */
    public LedgerException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    /**
     * 원인 포함 생성자.
     *
     * @param errorCode 실패 종류
     * @param message 오류 메시지
     * @param cause 원인 (null 허용)
     * @throws IllegalArgumentException errorCode가 null인 경우
     */
    public LedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(format(errorCode, message), cause);
        this.errorCode = errorCode;
    }

    private static String format(ErrorCode errorCode, String message) {
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        return errorCode.code() + " " + errorCode + ": " + message;
    }

    /**
     * 실패 종류 조회.
     *
     * @return ErrorCode
     */
    public ErrorCode errorCode() {
        return errorCode;
    }

    public static LedgerException invalidAddress(String message) {
        return new LedgerException(ErrorCode.INVALID_ADDRESS, message);
    }

    public static LedgerException notFound(String message) {
        return new LedgerException(ErrorCode.NOT_FOUND, message);
    }

    public static LedgerException invalidApproval(String message) {
        return new LedgerException(ErrorCode.INVALID_APPROVAL, message);
    }

    public static LedgerException unauthorized(String message) {
        return new LedgerException(ErrorCode.UNAUTHORIZED, message);
    }

    public static LedgerException ownershipMismatch(String message) {
        return new LedgerException(ErrorCode.OWNERSHIP_MISMATCH, message);
    }

    public static LedgerException receiverRejected(String message) {
        return new LedgerException(ErrorCode.RECEIVER_REJECTED, message);
    }
}
