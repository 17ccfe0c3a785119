// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.error;

import java.util.Objects;

/**
 * Thrown by {@link Outcome#orThrow()} when the operation was refused.
 *
 * <pre>{@code
 * try {
 *     gate.addAdmin(owner, candidate).orThrow();
 * } catch (RejectedException e) {
 *     if (e.error() == MintError.ALREADY_ADMIN) {
 *         // nothing to do
 *     }
 * }
 * }</pre>
 */
public final class RejectedException extends MintGateException {

    private final MintError error;
    private final String detail;

    public RejectedException(final MintError error, final String detail) {
        super(messageFor(error, detail));
        this.error = Objects.requireNonNull(error, "error");
        this.detail = detail;
    }

    private static String messageFor(final MintError error, final String detail) {
        final String base = error + ": " + error.description();
        return detail == null || detail.isEmpty() ? base : base + " (" + detail + ")";
    }

    public MintError error() {
        return error;
    }

    public String detail() {
        return detail;
    }
}
