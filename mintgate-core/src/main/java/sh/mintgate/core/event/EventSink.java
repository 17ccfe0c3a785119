// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.event;

import java.util.Objects;

/**
 * Channel that receives ledger observations.
 *
 * <p>Implementations must not block and must not call back into the ledger; events are
 * delivered while the ledger still holds its write lock so that observers see them in
 * commit order.
 */
@FunctionalInterface
public interface EventSink {

    void emit(LedgerEvent event);

    /**
     * Returns a sink that delivers to this sink, then to {@code next}.
     */
    default EventSink andThen(final EventSink next) {
        Objects.requireNonNull(next, "next");
        return event -> {
            emit(event);
            next.emit(event);
        };
    }

    static EventSink noop() {
        return event -> { };
    }
}
