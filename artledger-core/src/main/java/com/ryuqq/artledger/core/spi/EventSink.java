package com.ryuqq.artledger.core.spi;

import com.ryuqq.artledger.core.event.LedgerEvent;

/**
 * Receives ledger notifications after a call has completed successfully.
 *
 * <p>Events of a failed or reverted call are never delivered. Events are published
 * before the call commits; an exception thrown here reverts the whole call and reaches
 * the caller. A call that emits several events may therefore have delivered some of
 * them before being reverted.</p>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventSink {

    /**
     * Publishes one event.
     *
     * @param event the event, never null
     */
    void publish(LedgerEvent event);
}
