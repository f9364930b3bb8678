package com.ryuqq.artledger.core.event;

/**
 * 원장 상태 변경 알림.
 *
 * <ul>
 *   <li>{@link Transfer}: 발행(mint) 및 전송 시 소유권 변경</li>
 *   <li>{@link Approval}: 단일 자산 위임자 지정</li>
 *   <li>{@link ApprovalForAll}: 운영자 승인 설정/해제</li>
 * </ul>
 *
 * <p>호출이 성공적으로 끝난 경우에만 {@link com.ryuqq.artledger.core.spi.EventSink}로 발행됩니다.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public sealed interface LedgerEvent permits Transfer, Approval, ApprovalForAll {
}
