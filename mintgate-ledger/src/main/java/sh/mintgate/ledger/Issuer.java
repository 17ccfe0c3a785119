// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import java.math.BigInteger;
import java.util.Objects;

import sh.mintgate.core.error.IssuanceException;
import sh.mintgate.core.event.EventSink;
import sh.mintgate.core.event.TokenMinted;
import sh.mintgate.core.types.Address;
import sh.mintgate.core.types.TokenId;

/**
 * Delegates unit creation to the issuance primitive and records the result.
 *
 * <p>{@link #issue} is the only step of a mint that can fail after validation. Callers
 * invoke it before touching their own state, then call {@link #record} to mark the token
 * as existing and publish the observation.
 */
final class Issuer {

    private final IssuancePrimitive primitive;
    private final TokenRegistry tokens;
    private final EventSink events;

    Issuer(IssuancePrimitive primitive, TokenRegistry tokens, EventSink events) {
        this.primitive = Objects.requireNonNull(primitive, "primitive");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.events = Objects.requireNonNull(events, "events");
    }

    /**
     * @throws IssuanceException if the primitive throws
     */
    void issue(Address to, TokenId tokenId, BigInteger quantity, byte[] data) {
        try {
            primitive.issue(to, tokenId, quantity, data.clone());
        } catch (RuntimeException e) {
            throw new IssuanceException(to, tokenId, e);
        }
    }

    TokenMinted record(Address to, TokenId tokenId, BigInteger quantity) {
        tokens.markExists(tokenId);
        TokenMinted event = new TokenMinted(to, tokenId, quantity);
        events.emit(event);
        return event;
    }

    BigInteger balanceOfToken(Address holder, TokenId tokenId) {
        return primitive.balanceOfToken(holder, tokenId);
    }
}
