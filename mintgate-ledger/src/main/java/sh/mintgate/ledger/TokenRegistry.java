// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

import sh.mintgate.core.DebugLogger;
import sh.mintgate.core.LogFormatter;
import sh.mintgate.core.error.MintError;
import sh.mintgate.core.error.Outcome;
import sh.mintgate.core.event.EventSink;
import sh.mintgate.core.event.UriSet;
import sh.mintgate.core.types.Address;
import sh.mintgate.core.types.TokenId;

/**
 * Which token ids exist, and where their metadata lives.
 *
 * <p>A token exists once any units of it were issued. URI prefixes are independent of
 * existence and may be staged before the first issuance. The resolved URI is
 * {@code prefix + decimal(id) + ".json"}.
 *
 * <p>Not thread-safe; {@link MintGate} serializes access.
 */
final class TokenRegistry {

    static final String URI_SUFFIX = ".json";

    private static final Comparator<TokenId> BY_VALUE = Comparator.comparing(TokenId::value);

    private final AuthorizationRegistry authorization;
    private final EventSink events;
    private final Set<TokenId> existing = new HashSet<>();
    private final Map<TokenId, String> uriPrefixes = new HashMap<>();

    TokenRegistry(AuthorizationRegistry authorization, EventSink events) {
        this.authorization = Objects.requireNonNull(authorization, "authorization");
        this.events = Objects.requireNonNull(events, "events");
    }

    boolean exists(TokenId tokenId) {
        return existing.contains(Objects.requireNonNull(tokenId, "tokenId"));
    }

    /**
     * Idempotent.
     *
     * @return true if the token did not exist before
     */
    boolean markExists(TokenId tokenId) {
        return existing.add(Objects.requireNonNull(tokenId, "tokenId"));
    }

    Outcome<UriSet> setURI(Address caller, TokenId tokenId, String prefix) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(tokenId, "tokenId");
        Objects.requireNonNull(prefix, "prefix");
        if (!authorization.isAuthorized(caller)) {
            return Rejections.admin("setURI", caller, MintError.UNAUTHORIZED, "only the owner or an admin can set URIs");
        }

        String previous = uriPrefixes.put(tokenId, prefix);
        DebugLogger.logAdmin(LogFormatter.formatConfig("uri[" + tokenId.toDecimalString() + "]",
                previous == null ? "" : previous, prefix));
        UriSet event = new UriSet(tokenId, prefix);
        events.emit(event);
        return Outcome.success(event);
    }

    /**
     * The raw prefix, {@code ""} when never set. Does not require the token to exist.
     */
    String uriPrefix(TokenId tokenId) {
        return uriPrefixes.getOrDefault(Objects.requireNonNull(tokenId, "tokenId"), "");
    }

    Outcome<String> resolveURI(TokenId tokenId) {
        if (!exists(tokenId)) {
            return Outcome.rejected(MintError.UNKNOWN_TOKEN, tokenId.toDecimalString());
        }
        return Outcome.success(uriPrefix(tokenId) + tokenId.toDecimalString() + URI_SUFFIX);
    }

    /**
     * Existing ids in ascending order.
     */
    List<TokenId> existingTokens() {
        return existing.stream().sorted(BY_VALUE).toList();
    }

    /**
     * Staged and active prefixes ordered by id.
     */
    Map<TokenId, String> uriPrefixes() {
        Map<TokenId, String> ordered = new TreeMap<>(BY_VALUE);
        ordered.putAll(uriPrefixes);
        return ordered;
    }

    void restore(Iterable<TokenId> tokens, Map<TokenId, String> prefixes) {
        for (TokenId tokenId : tokens) {
            markExists(tokenId);
        }
        prefixes.forEach((id, prefix) -> uriPrefixes.put(
                Objects.requireNonNull(id, "tokenId"), Objects.requireNonNull(prefix, "prefix")));
    }
}
