// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger.memory;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import sh.mintgate.core.types.Address;
import sh.mintgate.ledger.BalanceOracle;

/**
 * Fungible-asset balances held in memory, one table per asset.
 *
 * <p>Stands in for an on-chain token contract in examples and tests. Unknown holders
 * have a zero balance. Thread-safe.
 */
public final class InMemoryBalanceOracle implements BalanceOracle {

    private final Map<Address, Map<Address, BigInteger>> balances = new ConcurrentHashMap<>();

    @Override
    public BigInteger balanceOf(final Address asset, final Address holder) {
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(holder, "holder");
        Map<Address, BigInteger> table = balances.get(asset);
        return table == null ? BigInteger.ZERO : table.getOrDefault(holder, BigInteger.ZERO);
    }

    /**
     * Replaces {@code holder}'s balance.
     *
     * @throws IllegalArgumentException if {@code amount} is negative
     */
    public InMemoryBalanceOracle setBalance(final Address asset, final Address holder, final BigInteger amount) {
        Objects.requireNonNull(holder, "holder");
        requireNonNegative(amount);
        table(asset).put(holder, amount);
        return this;
    }

    /**
     * Adds {@code amount} to {@code holder}'s balance.
     *
     * @throws IllegalArgumentException if {@code amount} is negative
     */
    public InMemoryBalanceOracle credit(final Address asset, final Address holder, final BigInteger amount) {
        Objects.requireNonNull(holder, "holder");
        requireNonNegative(amount);
        table(asset).merge(holder, amount, BigInteger::add);
        return this;
    }

    private Map<Address, BigInteger> table(final Address asset) {
        Objects.requireNonNull(asset, "asset");
        return balances.computeIfAbsent(asset, a -> new ConcurrentHashMap<>());
    }

    private static void requireNonNegative(final BigInteger amount) {
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be non-negative, got: " + amount);
        }
    }
}
