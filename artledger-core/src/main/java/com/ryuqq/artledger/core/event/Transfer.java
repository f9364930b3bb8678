package com.ryuqq.artledger.core.event;

import com.ryuqq.artledger.core.model.Identity;
import com.ryuqq.artledger.core.model.TokenId;

/**
 * 소유권 변경 알림. 발행 시 from은 {@link Identity#NULL}입니다.
 *
 * @param from 이전 소유자
 * @param to 새 소유자
 * @param tokenId 자산 식별자
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public record Transfer(
    Identity from,
    Identity to,
    TokenId tokenId
) implements LedgerEvent {

    public Transfer {
        if (from == null || to == null || tokenId == null) {
            throw new IllegalArgumentException("Transfer fields cannot be null");
        }
    }

    /**
     * 발행 여부.
     *
     * @return from이 null identity이면 true
     */
    public boolean isMint() {
        return from.isNull();
    }
}
