// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.mintgate.core.DebugLogger;
import sh.mintgate.core.LogFormatter;
import sh.mintgate.core.error.IssuanceException;
import sh.mintgate.core.error.MintError;
import sh.mintgate.core.error.Outcome;
import sh.mintgate.core.event.TokenMinted;
import sh.mintgate.core.types.Address;
import sh.mintgate.core.types.TokenId;

/**
 * Direct issuance by the owner or an admin, outside the one-time ledger.
 *
 * <p>These mints neither read nor write has-minted flags or {@code totalIssued}; they only
 * create units, mark tokens as existing and emit {@link TokenMinted}.
 *
 * <p>Not thread-safe; {@link MintGate} serializes access.
 */
final class CollectionMinter {

    private final AuthorizationRegistry authorization;
    private final Issuer issuer;

    CollectionMinter(AuthorizationRegistry authorization, Issuer issuer) {
        this.authorization = Objects.requireNonNull(authorization, "authorization");
        this.issuer = Objects.requireNonNull(issuer, "issuer");
    }

    /**
     * @throws IssuanceException if the primitive fails
     */
    Outcome<TokenMinted> mint(Address caller, Address to, TokenId tokenId, BigInteger amount, byte[] data) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(tokenId, "tokenId");
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(data, "data");
        if (!authorization.isAuthorized(caller)) {
            return Rejections.mint("mint", caller, MintError.UNAUTHORIZED, "only the owner or an admin can mint");
        }
        if (to.isZero()) {
            return Rejections.mint("mint", caller, MintError.INVALID_ADDRESS, to.value());
        }
        if (amount.signum() <= 0) {
            return Rejections.mint("mint", caller, MintError.INVALID_QUANTITY, amount.toString());
        }
        return Outcome.success(issue(caller, to, tokenId, amount, data));
    }

    /**
     * Validates every pair first, then issues them in order. If the primitive fails
     * part-way, pairs issued before the failure stay issued and the exception propagates.
     *
     * @throws IssuanceException if the primitive fails
     */
    Outcome<List<TokenMinted>> mintBatch(
            Address caller, Address to, List<TokenId> tokenIds, List<BigInteger> amounts, byte[] data) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(tokenIds, "tokenIds");
        Objects.requireNonNull(amounts, "amounts");
        Objects.requireNonNull(data, "data");
        if (!authorization.isAuthorized(caller)) {
            return Rejections.mint("mintBatch", caller, MintError.UNAUTHORIZED, "only the owner or an admin can mint");
        }
        if (to.isZero()) {
            return Rejections.mint("mintBatch", caller, MintError.INVALID_ADDRESS, to.value());
        }
        if (tokenIds.size() != amounts.size()) {
            return Rejections.mint("mintBatch", caller, MintError.LENGTH_MISMATCH,
                    "tokenIds=" + tokenIds.size() + " amounts=" + amounts.size());
        }
        for (int i = 0; i < amounts.size(); i++) {
            Objects.requireNonNull(tokenIds.get(i), "tokenIds[" + i + "]");
            BigInteger amount = Objects.requireNonNull(amounts.get(i), "amounts[" + i + "]");
            if (amount.signum() <= 0) {
                return Rejections.mint("mintBatch", caller, MintError.INVALID_QUANTITY, "amounts[" + i + "]=" + amount);
            }
        }

        List<TokenMinted> minted = new ArrayList<>(tokenIds.size());
        for (int i = 0; i < tokenIds.size(); i++) {
            minted.add(issue(caller, to, tokenIds.get(i), amounts.get(i), data));
        }
        return Outcome.success(List.copyOf(minted));
    }

    private TokenMinted issue(Address caller, Address to, TokenId tokenId, BigInteger amount, byte[] data) {
        issuer.issue(to, tokenId, amount, data);
        DebugLogger.logMint(LogFormatter.formatCollectionMint(caller, to, tokenId, amount));
        return issuer.record(to, tokenId, amount);
    }
}
