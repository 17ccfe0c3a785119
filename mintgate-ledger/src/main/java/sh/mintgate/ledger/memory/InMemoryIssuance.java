// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger.memory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.mintgate.core.types.Address;
import sh.mintgate.core.types.TokenId;
import sh.mintgate.ledger.IssuancePrimitive;

/**
 * Multi-token balances held in memory.
 *
 * <p>Stands in for the collection contract: {@link #issue} credits units, like an
 * ERC-1155 mint, and refuses the zero recipient and non-positive quantities the same way
 * the contract would revert. The {@code data} payload is accepted and ignored.
 * Thread-safe.
 */
public final class InMemoryIssuance implements IssuancePrimitive {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryIssuance.class);

    private final Map<TokenId, Map<Address, BigInteger>> balances = new HashMap<>();
    private final Map<TokenId, BigInteger> supply = new HashMap<>();

    @Override
    public synchronized void issue(final Address to, final TokenId tokenId, final BigInteger quantity, final byte[] data) {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(tokenId, "tokenId");
        Objects.requireNonNull(quantity, "quantity");
        Objects.requireNonNull(data, "data");
        if (to.isZero()) {
            throw new IllegalArgumentException("cannot issue to the zero address");
        }
        if (quantity.signum() <= 0) {
            throw new IllegalArgumentException("quantity must be positive, got: " + quantity);
        }
        balances.computeIfAbsent(tokenId, id -> new HashMap<>()).merge(to, quantity, BigInteger::add);
        supply.merge(tokenId, quantity, BigInteger::add);
        LOG.debug("issued {} of token {} to {}", quantity, tokenId.toDecimalString(), to);
    }

    @Override
    public synchronized BigInteger balanceOfToken(final Address holder, final TokenId tokenId) {
        Objects.requireNonNull(holder, "holder");
        Objects.requireNonNull(tokenId, "tokenId");
        Map<Address, BigInteger> holders = balances.get(tokenId);
        return holders == null ? BigInteger.ZERO : holders.getOrDefault(holder, BigInteger.ZERO);
    }

    /**
     * Units of {@code tokenId} issued so far, across all holders and mint paths.
     */
    public synchronized BigInteger totalSupply(final TokenId tokenId) {
        return supply.getOrDefault(Objects.requireNonNull(tokenId, "tokenId"), BigInteger.ZERO);
    }
}
