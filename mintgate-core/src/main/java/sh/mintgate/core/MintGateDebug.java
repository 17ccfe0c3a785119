// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core;

/**
 * Global toggle for verbose ledger logging.
 *
 * <p>Two independent channels: authorization (admin set, ownership, configuration) and
 * issuance (mints, batches, rejections). Flags are volatile; the compound read in
 * {@link #isEnabled()} is not atomic, which is acceptable for best-effort logging.
 */
public final class MintGateDebug {

    private static volatile boolean adminLogging = false;
    private static volatile boolean mintLogging = false;

    private MintGateDebug() {
    }

    public static boolean isEnabled() {
        return adminLogging || mintLogging;
    }

    public static void setEnabled(final boolean enabled) {
        adminLogging = enabled;
        mintLogging = enabled;
    }

    public static void setAdminLogging(final boolean enabled) {
        adminLogging = enabled;
    }

    public static boolean isAdminLoggingEnabled() {
        return adminLogging;
    }

    public static void setMintLogging(final boolean enabled) {
        mintLogging = enabled;
    }

    public static boolean isMintLoggingEnabled() {
        return mintLogging;
    }
}
