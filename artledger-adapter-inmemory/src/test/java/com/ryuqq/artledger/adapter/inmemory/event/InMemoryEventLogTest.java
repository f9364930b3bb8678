package com.ryuqq.artledger.adapter.inmemory.event;

import com.ryuqq.artledger.core.event.ApprovalForAll;
import com.ryuqq.artledger.core.event.LedgerEvent;
import com.ryuqq.artledger.core.event.Transfer;
import com.ryuqq.artledger.core.model.Identity;
import com.ryuqq.artledger.core.model.TokenId;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryEventLog 테스트.
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
class InMemoryEventLogTest {

    private static final Identity ALICE = Identity.of("0x000000000000000000000000000000000000a11c");
    private static final Identity BOB = Identity.of("0x0000000000000000000000000000000000000b0b");

    private final InMemoryEventLog log = new InMemoryEventLog();

    @Test
    void publish_KeepsOrderAndFiltersByType() {
        // given
        LedgerEvent mint = new Transfer(Identity.NULL, ALICE, TokenId.of(1));
        LedgerEvent operator = new ApprovalForAll(ALICE, BOB, true);
        LedgerEvent transfer = new Transfer(ALICE, BOB, TokenId.of(1));

        // when
        log.publish(mint);
        log.publish(operator);
        log.publish(transfer);

        // then
        assertThat(log.events()).containsExactly(mint, operator, transfer);
        assertThat(log.eventsOfType(Transfer.class)).containsExactly((Transfer) mint, (Transfer) transfer);
        assertThat(log.eventsOfType(Transfer.class).get(0).isMint()).isTrue();
        assertThat(log.size()).isEqualTo(3);
    }

    @Test
    void clear_RemovesEverything() {
        log.publish(new ApprovalForAll(ALICE, BOB, false));

        log.clear();

        assertThat(log.events()).isEmpty();
    }

    @Test
    void publish_Null_ThrowsException() {
        assertThatThrownBy(() -> log.publish(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
