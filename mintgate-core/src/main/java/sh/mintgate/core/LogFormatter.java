// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core;

import static sh.mintgate.core.AnsiColors.*;

import java.math.BigInteger;
import java.util.Locale;

import sh.mintgate.core.error.MintError;
import sh.mintgate.core.event.AdminAdded;
import sh.mintgate.core.event.AdminRemoved;
import sh.mintgate.core.event.AssetUpdated;
import sh.mintgate.core.event.LedgerEvent;
import sh.mintgate.core.event.MintQuantityUpdated;
import sh.mintgate.core.event.MintableTokenIdUpdated;
import sh.mintgate.core.event.OwnershipTransferred;
import sh.mintgate.core.event.RequiredBalanceUpdated;
import sh.mintgate.core.event.TokenMinted;
import sh.mintgate.core.event.UriSet;
import sh.mintgate.core.types.Address;
import sh.mintgate.core.types.TokenId;

/**
 * Log formatter for ledger operations with coloured, bracketed output.
 *
 * <p>
 * Every line starts with a bracketed tag and carries {@code key=value} fields. Status
 * symbols mark outcomes: ✓ applied, ✗ refused or failed, ○ skipped.
 *
 * <pre>{@code
 * ✓ [MINT] to=0x1234...5678 tokenId=0 quantity=1 totalIssued=1
 * ✗ [REJECT] op=selfMint caller=0x1234...5678 error=ALREADY_MINTED
 * [BATCH] requested=3 minted=2 skipped=1 failed=0 duration=0.42ms
 * [CONFIG] field=mintQuantity old=1 new=3
 * }</pre>
 *
 * <p>
 * All methods are pure and thread-safe. Untrusted strings are escaped through
 * {@link LogSanitizer#quote(String)}.
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    /** Characters kept from the start of an address, including "0x". */
    private static final int ADDRESS_PREFIX_LENGTH = 6;

    /** Characters kept from the end of an address. */
    private static final int ADDRESS_SUFFIX_LENGTH = 4;

    private static final int ADDRESS_SHORTEN_THRESHOLD = ADDRESS_PREFIX_LENGTH + ADDRESS_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: ✓ [MINT] to=0x1234...5678 tokenId=0 quantity=1 totalIssued=1
     */
    public static String formatMint(Address to, TokenId tokenId, BigInteger quantity, BigInteger totalIssued) {
        return String.format(
                "%s✓%s %s[MINT]%s to=%s tokenId=%s quantity=%s totalIssued=%s",
                TEAL, RESET,
                TEAL, RESET,
                shortenAddress(to),
                tokenId.toDecimalString(),
                quantity,
                totalIssued);
    }

    /**
     * Format: ✓ [COLLECTION-MINT] by=0x1234...5678 to=0xabcd...ef01 tokenId=7 amount=100
     */
    public static String formatCollectionMint(Address caller, Address to, TokenId tokenId, BigInteger amount) {
        return String.format(
                "%s✓%s %s[COLLECTION-MINT]%s by=%s to=%s tokenId=%s amount=%s",
                TEAL, RESET,
                TEAL, RESET,
                shortenAddress(caller),
                shortenAddress(to),
                tokenId.toDecimalString(),
                amount);
    }

    /**
     * Format: ○ [SKIP] to=0x1234...5678 reason=ALREADY_MINTED
     */
    public static String formatSkip(Address to, String reason) {
        return String.format(
                "%s○%s %s[SKIP]%s to=%s reason=%s",
                SLATE, RESET,
                SLATE, RESET,
                shortenAddress(to),
                reason);
    }

    /**
     * Format: [BATCH] requested=3 minted=2 skipped=1 failed=0 duration=0.42ms
     */
    public static String formatBatch(int requested, int minted, int skipped, int failed, long durationMicros) {
        return String.format(
                "%s[BATCH]%s requested=%d minted=%d skipped=%d failed=%d %s",
                INDIGO, RESET,
                requested, minted, skipped, failed,
                duration(durationMicros));
    }

    /**
     * Format: ✗ [REJECT] op=selfMint caller=0x1234...5678 error=ALREADY_MINTED detail=...
     */
    public static String formatReject(String operation, Address caller, MintError error, String detail) {
        return String.format(
                "%s✗%s %s[REJECT]%s op=%s caller=%s error=%s%s%s detail=%s",
                CORAL, RESET,
                CORAL, RESET,
                operation,
                shortenAddress(caller),
                CORAL, error, RESET,
                LogSanitizer.quote(detail));
    }

    /**
     * Format: ✗ [ISSUE-FAILED] to=0x1234...5678 tokenId=0 reason="..."
     */
    public static String formatIssuanceFailure(Address to, TokenId tokenId, String reason) {
        return String.format(
                "%s✗%s %s[ISSUE-FAILED]%s to=%s tokenId=%s reason=%s",
                CORAL, RESET,
                CORAL, RESET,
                shortenAddress(to),
                tokenId.toDecimalString(),
                LogSanitizer.quote(reason));
    }

    /**
     * Format: ✓ [ADMIN] action=added admin=0x1234...5678 adminCount=1
     */
    public static String formatAdmin(String action, Address subject, int adminCount) {
        return String.format(
                "%s✓%s %s[ADMIN]%s action=%s admin=%s adminCount=%d",
                TEAL, RESET,
                LAVENDER, RESET,
                action,
                shortenAddress(subject),
                adminCount);
    }

    /**
     * Format: ✓ [OWNER] from=0x1234...5678 to=0xabcd...ef01
     */
    public static String formatOwnership(Address previousOwner, Address newOwner) {
        return String.format(
                "%s✓%s %s[OWNER]%s from=%s to=%s",
                TEAL, RESET,
                LAVENDER, RESET,
                shortenAddress(previousOwner),
                shortenAddress(newOwner));
    }

    /**
     * Format: [CONFIG] field=requiredBalance old=10100000 new=5000000
     */
    public static String formatConfig(String field, Object oldValue, Object newValue) {
        return String.format(
                "%s[CONFIG]%s field=%s old=%s new=%s",
                AMBER, RESET,
                field,
                render(oldValue),
                render(newValue));
    }

    /**
     * One-line rendering of an observation, used by the logging event sink.
     * Format: [EVENT] TokenMinted to=0x1234...5678 tokenId=0 quantity=1
     */
    public static String formatEvent(LedgerEvent event) {
        return String.format("%s[EVENT]%s %s %s", SLATE, RESET, event.name(), eventFields(event));
    }

    private static String eventFields(LedgerEvent event) {
        if (event instanceof AdminAdded e) {
            return "admin=" + e.admin();
        }
        if (event instanceof AdminRemoved e) {
            return "admin=" + e.admin();
        }
        if (event instanceof OwnershipTransferred e) {
            return "previousOwner=" + e.previousOwner() + " newOwner=" + e.newOwner();
        }
        if (event instanceof TokenMinted e) {
            return "to=" + e.to() + " tokenId=" + e.tokenId().toDecimalString() + " quantity=" + e.quantity();
        }
        if (event instanceof UriSet e) {
            return "tokenId=" + e.tokenId().toDecimalString() + " uri=" + LogSanitizer.quote(e.uri());
        }
        if (event instanceof AssetUpdated e) {
            return "old=" + e.oldAsset() + " new=" + e.newAsset();
        }
        if (event instanceof RequiredBalanceUpdated e) {
            return "old=" + e.oldBalance() + " new=" + e.newBalance();
        }
        if (event instanceof MintableTokenIdUpdated e) {
            return "old=" + e.oldTokenId().toDecimalString() + " new=" + e.newTokenId().toDecimalString();
        }
        if (event instanceof MintQuantityUpdated e) {
            return "old=" + e.oldQuantity() + " new=" + e.newQuantity();
        }
        return String.valueOf(event);
    }

    private static String render(Object value) {
        if (value instanceof TokenId id) {
            return id.toDecimalString();
        }
        if (value instanceof Address address) {
            return shortenAddress(address);
        }
        if (value instanceof String text) {
            return LogSanitizer.quote(text);
        }
        return String.valueOf(value);
    }

    /**
     * Helper: format duration in microseconds as human-readable string
     */
    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted = ms < 1000
                ? String.format(Locale.ROOT, "%.2fms", ms)
                : String.format(Locale.ROOT, "%.2fs", ms / 1000.0);
        return SLATE + "duration=" + formatted + RESET;
    }

    /**
     * Shortens an address to {@code 0xabcd...ef12}.
     *
     * @param address the address, may be null
     * @return the shortened form, or "null"
     */
    static String shortenAddress(Address address) {
        if (address == null) {
            return "null";
        }
        String full = address.value();
        if (full.length() <= ADDRESS_SHORTEN_THRESHOLD) {
            return full;
        }
        return full.substring(0, ADDRESS_PREFIX_LENGTH)
                + "..."
                + full.substring(full.length() - ADDRESS_SUFFIX_LENGTH);
    }
}
