// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for ledger operations.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.mintgate.debug");

    private DebugLogger() {
    }

    public static void logAdmin(final String message, final Object... args) {
        if (!MintGateDebug.isAdminLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logMint(final String message, final Object... args) {
        if (!MintGateDebug.isMintLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!MintGateDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Coloured output goes straight to stdout on a TTY; everything else goes to SLF4J.
     * Messages are always sanitized first.
     */
    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        final String sanitized = LogSanitizer.sanitize(formatted);

        if (AnsiColors.IS_TTY) {
            System.out.println(sanitized);
        } else {
            LOG.info(sanitized);
        }
    }
}
