// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.mintgate.core.LogFormatter;
import sh.mintgate.core.LogSanitizer;

/**
 * Sink that writes each observation to SLF4J at INFO under {@code sh.mintgate.events}.
 */
public final class LoggingEventSink implements EventSink {

    private static final Logger LOG = LoggerFactory.getLogger("sh.mintgate.events");

    @Override
    public void emit(final LedgerEvent event) {
        if (LOG.isInfoEnabled()) {
            LOG.info(LogSanitizer.sanitize(LogFormatter.formatEvent(event)));
        }
    }
}
