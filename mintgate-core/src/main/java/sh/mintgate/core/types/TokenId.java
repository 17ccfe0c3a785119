// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.types;

import java.math.BigInteger;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Credential token identifier.
 *
 * <p>Wraps the {@code uint256} id of a multi-token collection entry. Identifiers carry no
 * upper bound here; the issuance primitive decides what it can represent.
 *
 * @param value the token id (must be non-negative)
 * @throws NullPointerException     if value is null
 * @throws IllegalArgumentException if value is negative
 */
public record TokenId(@JsonValue BigInteger value) {

    public static final TokenId ZERO = new TokenId(BigInteger.ZERO);

    public TokenId {
        Objects.requireNonNull(value, "tokenId");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("tokenId must be non-negative");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TokenId of(final BigInteger value) {
        return new TokenId(value);
    }

    public static TokenId of(final long id) {
        return new TokenId(BigInteger.valueOf(id));
    }

    /**
     * Base-10 rendering, the form used inside metadata URIs.
     */
    public String toDecimalString() {
        return value.toString(10);
    }

    @Override
    public String toString() {
        return "TokenId(" + value + ")";
    }
}
