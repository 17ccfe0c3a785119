// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.mintgate.core.LogFormatter;
import sh.mintgate.core.LogSanitizer;
import sh.mintgate.core.event.EventSink;
import sh.mintgate.core.event.LedgerEvent;

/**
 * Forwards events to the configured sink and contains its failures.
 *
 * <p>Events are emitted after a mutation has committed. A sink that throws is logged at
 * WARN and the operation still reports the committed result.
 */
final class GuardedEventSink implements EventSink {

    private static final Logger LOG = LoggerFactory.getLogger(GuardedEventSink.class);

    private final EventSink delegate;

    GuardedEventSink(EventSink delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void emit(LedgerEvent event) {
        try {
            delegate.emit(event);
        } catch (RuntimeException e) {
            LOG.warn("Event sink failed on {}", LogSanitizer.sanitize(LogFormatter.formatEvent(event)), e);
        }
    }
}
