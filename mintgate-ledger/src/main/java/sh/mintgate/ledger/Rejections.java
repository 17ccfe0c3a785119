// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import sh.mintgate.core.DebugLogger;
import sh.mintgate.core.LogFormatter;
import sh.mintgate.core.error.MintError;
import sh.mintgate.core.error.Outcome;
import sh.mintgate.core.types.Address;

/**
 * Builds rejected outcomes and logs them on the matching debug channel.
 */
final class Rejections {

    private Rejections() {
    }

    static <T> Outcome<T> admin(String operation, Address caller, MintError error, String detail) {
        DebugLogger.logAdmin(LogFormatter.formatReject(operation, caller, error, detail));
        return Outcome.rejected(error, detail);
    }

    static <T> Outcome<T> mint(String operation, Address caller, MintError error, String detail) {
        DebugLogger.logMint(LogFormatter.formatReject(operation, caller, error, detail));
        return Outcome.rejected(error, detail);
    }
}
