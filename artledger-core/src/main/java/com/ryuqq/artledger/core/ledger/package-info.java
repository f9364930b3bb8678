/**
 * 소유권 원장 도메인 서비스.
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>Check-then-act:</strong> 모든 검증이 첫 쓰기보다 먼저 수행됨</li>
 *   <li><strong>원자성:</strong> 실패한 호출은 store 상태와 알림을 남기지 않음</li>
 * </ul>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
package com.ryuqq.artledger.core.ledger;
