package com.ryuqq.artledger.core.error;

/**
 * 원장 연산 실패 종류.
 *
 * <p>모든 실패는 연산 전체를 중단시키며, 원장 상태는 호출 이전과 동일하게 유지됩니다.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public enum ErrorCode {

    /**
     * 실제 소유자/수신자가 필요한 자리에 null identity가 전달됨.
     */
    INVALID_ADDRESS("LEDGER-400"),

    /**
     * 발행되지 않은 자산 참조.
     */
    NOT_FOUND("LEDGER-404"),

    /**
     * 자기 자신 승인 또는 현재 소유자에 대한 승인.
     */
    INVALID_APPROVAL("LEDGER-422"),

    /**
     * 호출자에게 소유자/위임자/운영자 권한이 없음.
     */
    UNAUTHORIZED("LEDGER-403"),

    /**
     * 지정한 from이 기록된 소유자와 다름.
     */
    OWNERSHIP_MISMATCH("LEDGER-409"),

    /**
     * 안전 전송 수신 확인 값이 없거나 다름.
     */
    RECEIVER_REJECTED("LEDGER-417");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    /**
     * 외부 노출용 오류 코드.
     *
     * @return 오류 코드 (예: LEDGER-404)
     */
    public String code() {
        return code;
    }
}
