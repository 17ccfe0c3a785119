// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.event;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory sink that keeps every event in arrival order.
 *
 * <p>Meant for indexers running in-process and for tests. Thread-safe.
 */
public final class RecordingEventSink implements EventSink {

    private final List<LedgerEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void emit(final LedgerEvent event) {
        events.add(Objects.requireNonNull(event, "event"));
    }

    /**
     * Returns an immutable copy of all recorded events.
     */
    public List<LedgerEvent> events() {
        return List.copyOf(events);
    }

    /**
     * Returns recorded events of one kind, in arrival order.
     */
    public <E extends LedgerEvent> List<E> eventsOf(final Class<E> type) {
        Objects.requireNonNull(type, "type");
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
