// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import java.math.BigInteger;

import sh.mintgate.core.types.Address;

/**
 * Read-only source of asset balances used by the eligibility check.
 *
 * <p>Typically backed by a fungible-token {@code balanceOf} call. Implementations must
 * not mutate anything and must return a non-negative value; any thrown exception is
 * surfaced to the caller as {@link sh.mintgate.core.error.OracleException}.
 */
@FunctionalInterface
public interface BalanceOracle {

    /**
     * Returns {@code holder}'s balance of {@code asset} in asset-native units.
     *
     * @param asset  the balance-bearing asset
     * @param holder the account being checked
     * @return the balance, never null or negative
     */
    BigInteger balanceOf(Address asset, Address holder);
}
