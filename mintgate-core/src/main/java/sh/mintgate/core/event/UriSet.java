// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.event;

import java.util.Objects;

import sh.mintgate.core.types.TokenId;

/**
 * A token's metadata URI prefix was written.
 *
 * @param tokenId the token id
 * @param uri     the new prefix
 */
public record UriSet(TokenId tokenId, String uri) implements LedgerEvent {

    public UriSet {
        Objects.requireNonNull(tokenId, "tokenId");
        Objects.requireNonNull(uri, "uri");
    }
}
