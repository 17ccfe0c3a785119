// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.event;

import java.util.Objects;

import sh.mintgate.core.types.TokenId;

/**
 * The token id issued by self-service and batch mints changed.
 *
 * @param oldTokenId the previous id
 * @param newTokenId the id issued from now on
 */
public record MintableTokenIdUpdated(TokenId oldTokenId, TokenId newTokenId) implements LedgerEvent {

    public MintableTokenIdUpdated {
        Objects.requireNonNull(oldTokenId, "oldTokenId");
        Objects.requireNonNull(newTokenId, "newTokenId");
    }
}
