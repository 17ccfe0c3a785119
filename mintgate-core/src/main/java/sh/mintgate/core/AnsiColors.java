// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core;

/**
 * ANSI colour palette for terminal log output.
 *
 * <p>Colours are emitted only on a TTY, or when {@code FORCE_COLOR=true} is set; otherwise
 * every constant is the empty string so formatted messages stay clean in log files.
 *
 * <ul>
 * <li><b>TEAL</b> - successful issuance and admin changes
 * <li><b>CORAL</b> - rejections and collaborator failures
 * <li><b>INDIGO</b> - batch summaries
 * <li><b>AMBER</b> - configuration changes
 * <li><b>LAVENDER</b> - authorization changes
 * <li><b>SLATE</b> - secondary fields such as durations
 * </ul>
 *
 * @see LogFormatter
 */
public final class AnsiColors {

    static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    public static final String RESET = ansi("0");
    public static final String TEAL = ansi("38;5;44");
    public static final String CORAL = ansi("38;5;204");
    public static final String INDIGO = ansi("38;5;99");
    public static final String AMBER = ansi("38;5;214");
    public static final String LAVENDER = ansi("38;5;183");
    public static final String SLATE = ansi("38;5;247");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }
}
