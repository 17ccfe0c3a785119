// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core;

/**
 * Cleans log payloads before they reach an appender.
 *
 * <p>
 * Two concerns:
 * <ul>
 * <li>User-supplied strings (URI prefixes, metadata) must not forge log lines, so control
 * characters are escaped by {@link #quote(String)}</li>
 * <li>Excessively long messages, such as a batch of thousands of addresses, are truncated</li>
 * </ul>
 */
public final class LogSanitizer {

    /** Maximum length of a sanitized log message. */
    private static final int MAX_LOG_LENGTH = 2000;

    /** Suffix appended to truncated logs. */
    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** Longest user value rendered by {@link #quote(String)}. */
    private static final int MAX_VALUE_LENGTH = 256;

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }
        if (input.length() <= MAX_LOG_LENGTH) {
            return input;
        }
        final int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
        return input.substring(0, truncateAt) + TRUNCATION_SUFFIX;
    }

    /**
     * Renders an untrusted value inside double quotes with control characters, quotes and
     * backslashes escaped.
     *
     * @param value the value, may be null
     * @return the quoted value, or {@code null} unquoted
     */
    public static String quote(final String value) {
        if (value == null) {
            return "null";
        }
        final String clipped = value.length() > MAX_VALUE_LENGTH
                ? value.substring(0, MAX_VALUE_LENGTH) + "..."
                : value;
        final StringBuilder sb = new StringBuilder(clipped.length() + 2).append('"');
        for (int i = 0; i < clipped.length(); i++) {
            final char c = clipped.charAt(i);
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                default -> {
                    if (Character.isISOControl(c)) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
