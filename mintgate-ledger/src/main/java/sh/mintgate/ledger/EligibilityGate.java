// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import java.math.BigInteger;
import java.util.Objects;

import sh.mintgate.core.DebugLogger;
import sh.mintgate.core.LogFormatter;
import sh.mintgate.core.error.MintError;
import sh.mintgate.core.error.OracleException;
import sh.mintgate.core.error.Outcome;
import sh.mintgate.core.event.AssetUpdated;
import sh.mintgate.core.event.EventSink;
import sh.mintgate.core.event.RequiredBalanceUpdated;
import sh.mintgate.core.types.Address;

/**
 * Balance-threshold eligibility.
 *
 * <p>An address qualifies when its balance of the configured asset is at least the
 * required balance. The check reads the oracle on every call, so configuration changes
 * apply to all later checks, including addresses that failed under the old values.
 *
 * <p>Not thread-safe; {@link MintGate} serializes access.
 */
final class EligibilityGate {

    private final BalanceOracle oracle;
    private final AuthorizationRegistry authorization;
    private final EventSink events;
    private Address asset;
    private BigInteger requiredBalance;

    EligibilityGate(
            BalanceOracle oracle,
            AuthorizationRegistry authorization,
            EventSink events,
            Address asset,
            BigInteger requiredBalance) {
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.authorization = Objects.requireNonNull(authorization, "authorization");
        this.events = Objects.requireNonNull(events, "events");
        Objects.requireNonNull(asset, "asset");
        if (asset.isZero()) {
            throw new IllegalArgumentException("asset cannot be the null identity");
        }
        this.asset = asset;
        this.requiredBalance = requireUnsigned(requiredBalance);
    }

    Address asset() {
        return asset;
    }

    BigInteger requiredBalance() {
        return requiredBalance;
    }

    boolean hasSufficientBalance(Address holder) {
        return describeBalance(holder).compareTo(requiredBalance) >= 0;
    }

    /**
     * Passthrough oracle query.
     *
     * @throws OracleException if the oracle throws or returns an invalid balance
     */
    BigInteger describeBalance(Address holder) {
        Objects.requireNonNull(holder, "holder");
        final BigInteger balance;
        try {
            balance = oracle.balanceOf(asset, holder);
        } catch (RuntimeException e) {
            throw new OracleException(asset, holder, e);
        }
        if (balance == null || balance.signum() < 0) {
            throw new OracleException(asset, holder,
                    new IllegalStateException("oracle returned invalid balance " + balance));
        }
        return balance;
    }

    Outcome<AssetUpdated> updateAsset(Address caller, Address newAsset) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(newAsset, "newAsset");
        if (!authorization.isOwner(caller)) {
            return Rejections.admin("updateAsset", caller, MintError.UNAUTHORIZED, "only the owner can change the asset");
        }
        if (newAsset.isZero()) {
            return Rejections.admin("updateAsset", caller, MintError.INVALID_ADDRESS, newAsset.value());
        }

        Address previous = asset;
        asset = newAsset;
        DebugLogger.logAdmin(LogFormatter.formatConfig("asset", previous, newAsset));
        AssetUpdated event = new AssetUpdated(previous, newAsset);
        events.emit(event);
        return Outcome.success(event);
    }

    /**
     * @throws IllegalArgumentException if {@code newThreshold} is negative
     */
    Outcome<RequiredBalanceUpdated> updateThreshold(Address caller, BigInteger newThreshold) {
        Objects.requireNonNull(caller, "caller");
        if (!authorization.isOwner(caller)) {
            return Rejections.admin("updateThreshold", caller, MintError.UNAUTHORIZED,
                    "only the owner can change the required balance");
        }
        requireUnsigned(newThreshold);

        BigInteger previous = requiredBalance;
        requiredBalance = newThreshold;
        DebugLogger.logAdmin(LogFormatter.formatConfig("requiredBalance", previous, newThreshold));
        RequiredBalanceUpdated event = new RequiredBalanceUpdated(previous, newThreshold);
        events.emit(event);
        return Outcome.success(event);
    }

    private static BigInteger requireUnsigned(BigInteger value) {
        Objects.requireNonNull(value, "requiredBalance");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("requiredBalance must be non-negative");
        }
        return value;
    }
}
