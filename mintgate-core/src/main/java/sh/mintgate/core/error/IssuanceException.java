// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.error;

import sh.mintgate.core.types.Address;
import sh.mintgate.core.types.TokenId;

/**
 * Thrown when the issuance primitive fails to create units.
 *
 * <p>The failure is fatal for that single mint. When it escapes a self-service mint the
 * ledger has not recorded anything for the recipient.
 *
 * @since 0.1.0
 */
public final class IssuanceException extends MintGateException {

    private final Address recipient;
    private final TokenId tokenId;

    public IssuanceException(final Address recipient, final TokenId tokenId, final Throwable cause) {
        super("Issuance of " + tokenId + " to " + recipient + " failed: " + cause.getMessage(), cause);
        this.recipient = recipient;
        this.tokenId = tokenId;
    }

    public Address recipient() {
        return recipient;
    }

    public TokenId tokenId() {
        return tokenId;
    }
}
