// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.event;

import java.math.BigInteger;
import java.util.Objects;

import sh.mintgate.core.types.Address;
import sh.mintgate.core.types.TokenId;

/**
 * Units of a token were issued to an address.
 *
 * @param to       the recipient
 * @param tokenId  the issued token id
 * @param quantity the number of units issued
 */
public record TokenMinted(Address to, TokenId tokenId, BigInteger quantity) implements LedgerEvent {

    public TokenMinted {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(tokenId, "tokenId");
        Objects.requireNonNull(quantity, "quantity");
    }
}
