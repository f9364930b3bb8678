package com.ryuqq.artledger.core.event;

import com.ryuqq.artledger.core.model.Identity;
import com.ryuqq.artledger.core.model.TokenId;

/**
 * 위임자 지정 알림.
 *
 * @param owner 자산 소유자
 * @param approved 지정된 위임자 ({@link Identity#NULL}이면 위임 해제)
 * @param tokenId 자산 식별자
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public record Approval(
    Identity owner,
    Identity approved,
    TokenId tokenId
) implements LedgerEvent {

    public Approval {
        if (owner == null || approved == null || tokenId == null) {
            throw new IllegalArgumentException("Approval fields cannot be null");
        }
    }
}
