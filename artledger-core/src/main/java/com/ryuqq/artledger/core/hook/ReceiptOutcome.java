package com.ryuqq.artledger.core.hook;

/**
 * 안전 전송 수신 확인 결과.
 *
 * <ul>
 *   <li>{@link Skipped}: 수신자가 코드를 갖지 않아 확인 생략 (수락)</li>
 *   <li>{@link Acknowledged}: 수신자가 magic value 반환 (수락)</li>
 *   <li>{@link Rejected}: 호출 실패, 콜백 없음, 잘못된 반환값 (거부)</li>
 * </ul>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public sealed interface ReceiptOutcome permits Skipped, Acknowledged, Rejected {

    /**
     * 전송 수락 여부.
     *
     * @return Skipped 또는 Acknowledged이면 true
     */
    default boolean isAccepted() {
        return !(this instanceof Rejected);
    }
}
