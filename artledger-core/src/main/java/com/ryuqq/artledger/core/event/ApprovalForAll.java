package com.ryuqq.artledger.core.event;

import com.ryuqq.artledger.core.model.Identity;

/**
 * 운영자 승인 변경 알림.
 *
 * @param owner 소유자
 * @param operator 운영자
 * @param approved 승인 여부
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public record ApprovalForAll(
    Identity owner,
    Identity operator,
    boolean approved
) implements LedgerEvent {

    public ApprovalForAll {
        if (owner == null || operator == null) {
            throw new IllegalArgumentException("owner and operator cannot be null");
        }
    }
}
