// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import java.math.BigInteger;

import sh.mintgate.core.types.Address;
import sh.mintgate.core.types.TokenId;

/**
 * The component that materializes token units once the ledger's gates pass.
 *
 * <p>The ledger calls {@link #issue} only after all of its own checks succeeded and
 * treats any exception as fatal for that single mint.
 */
public interface IssuancePrimitive {

    /**
     * Creates {@code quantity} units of {@code tokenId} owned by {@code to}.
     *
     * @param to       the recipient
     * @param tokenId  the token to issue
     * @param quantity number of units, at least 1
     * @param data     opaque payload forwarded to the recipient hook, may be empty
     * @throws RuntimeException if the units could not be created
     */
    void issue(Address to, TokenId tokenId, BigInteger quantity, byte[] data);

    /**
     * Returns how many units of {@code tokenId} {@code holder} owns. Used by observers;
     * the ledger never reads it.
     */
    BigInteger balanceOfToken(Address holder, TokenId tokenId);
}
