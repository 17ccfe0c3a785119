// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import sh.mintgate.core.types.Address;
import sh.mintgate.core.types.TokenId;

/**
 * Point-in-time export of a {@link MintGate}.
 *
 * <p>Captures the authorization table, the eligibility configuration, the issuance ledger
 * and the token registry together, taken under one read lock so the four are mutually
 * consistent. Feed it to {@link MintGate.Builder#restore(LedgerSnapshot)} to rebuild a
 * gate with the same state.
 *
 * <pre>{@code
 * String json = gate.snapshot().toJson();
 * MintGate copy = MintGate.builder()
 *     .oracle(oracle)
 *     .issuance(issuance)
 *     .restore(LedgerSnapshot.fromJson(json))
 *     .build();
 * }</pre>
 *
 * @param name            collection name
 * @param symbol          collection symbol
 * @param owner           current owner
 * @param admins          admin set, in insertion order
 * @param asset           asset gating self-service mints
 * @param requiredBalance balance threshold
 * @param mintableTokenId token id for self-service and batch mints
 * @param mintQuantity    units per self-service or batch mint
 * @param minted          addresses that have minted, in mint order
 * @param totalIssued     units issued through self-service and batch mints
 * @param existingTokens  token ids that have been issued, ascending
 * @param uris            URI prefixes ordered by token id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerSnapshot(
        String name,
        String symbol,
        Address owner,
        List<Address> admins,
        Address asset,
        BigInteger requiredBalance,
        TokenId mintableTokenId,
        BigInteger mintQuantity,
        List<Address> minted,
        BigInteger totalIssued,
        List<TokenId> existingTokens,
        List<UriEntry> uris) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public LedgerSnapshot {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(requiredBalance, "requiredBalance");
        Objects.requireNonNull(mintableTokenId, "mintableTokenId");
        Objects.requireNonNull(mintQuantity, "mintQuantity");
        Objects.requireNonNull(totalIssued, "totalIssued");
        admins = admins == null ? List.of() : List.copyOf(admins);
        minted = minted == null ? List.of() : List.copyOf(minted);
        existingTokens = existingTokens == null ? List.of() : List.copyOf(existingTokens);
        uris = uris == null ? List.of() : List.copyOf(uris);
    }

    /**
     * A URI prefix assigned to one token id.
     *
     * @param tokenId the token
     * @param prefix  the raw prefix
     */
    public record UriEntry(TokenId tokenId, String prefix) {
        public UriEntry {
            Objects.requireNonNull(tokenId, "tokenId");
            Objects.requireNonNull(prefix, "prefix");
        }
    }

    /**
     * Parses an export produced by {@link #toJson()}.
     *
     * @throws IllegalArgumentException if the JSON is malformed or misses a required field
     */
    public static LedgerSnapshot fromJson(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return MAPPER.readValue(json, LedgerSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid ledger snapshot JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Ledger snapshot is not serializable", e);
        }
    }
}
