package com.ryuqq.artledger.adapter.inmemory.event;

import com.ryuqq.artledger.core.event.LedgerEvent;
import com.ryuqq.artledger.core.spi.EventSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link EventSink} SPI that keeps every committed event.
 *
 * <p>CopyOnWriteArrayList provides thread-safe iteration and snapshot isolation
 * for readers while the ledger keeps publishing.</p>
 *
 * <pre>
 * InMemoryEventLog log = new InMemoryEventLog();
 * ...
 * List&lt;Transfer&gt; transfers = log.eventsOfType(Transfer.class);
 * </pre>
 *
 * @author ArtLedger Team
 * @since 1.0.0
 */
public class InMemoryEventLog implements EventSink {

    private final List<LedgerEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(LedgerEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.add(event);
    }

    /**
     * Returns all events in publication order.
     *
     * @return immutable snapshot
     */
    public List<LedgerEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Returns the events of one kind in publication order.
     *
     * @param type the event record type
     * @param <T> event type
     * @return immutable snapshot
     */
    public <T extends LedgerEvent> List<T> eventsOfType(Class<T> type) {
        return events.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toUnmodifiableList());
    }

    public int size() {
        return events.size();
    }

    /**
     * Clears all events (for testing).
     */
    public void clear() {
        events.clear();
    }
}
