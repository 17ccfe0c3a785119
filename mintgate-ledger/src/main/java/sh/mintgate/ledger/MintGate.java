// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;

import sh.mintgate.core.error.IssuanceException;
import sh.mintgate.core.error.OracleException;
import sh.mintgate.core.error.Outcome;
import sh.mintgate.core.event.AdminAdded;
import sh.mintgate.core.event.AdminRemoved;
import sh.mintgate.core.event.AssetUpdated;
import sh.mintgate.core.event.EventSink;
import sh.mintgate.core.event.MintQuantityUpdated;
import sh.mintgate.core.event.MintableTokenIdUpdated;
import sh.mintgate.core.event.OwnershipTransferred;
import sh.mintgate.core.event.RequiredBalanceUpdated;
import sh.mintgate.core.event.TokenMinted;
import sh.mintgate.core.event.UriSet;
import sh.mintgate.core.types.Address;
import sh.mintgate.core.types.TokenId;

/**
 * Balance-gated, one-time credential issuance.
 *
 * <p>A {@code MintGate} owns the authorization table, the eligibility configuration, the
 * token registry and the issuance ledger, and is the only way to read or change them.
 * Any address holding at least {@link #requiredBalance()} of {@link #asset()} may call
 * {@link #selfMint(Address)} once; the owner may {@link #batchMint batch-mint} to anyone
 * regardless of balance; the owner and admins may set metadata URIs and issue arbitrary
 * collection mints.
 *
 * <p><strong>Results:</strong> every operation that can be refused by a business rule
 * returns an {@link Outcome}. Refusals never throw; call {@link Outcome#orThrow()} to turn
 * one into a {@link sh.mintgate.core.error.RejectedException}. Exceptions are reserved for
 * collaborator failures ({@link OracleException}, {@link IssuanceException}) and for
 * programming errors such as null arguments.
 *
 * <p><strong>Thread safety:</strong> all state sits behind one read-write lock. Reads run
 * concurrently; every check-and-update runs under the write lock, and events are emitted
 * before the lock is released, so sinks observe them in commit order. A sink that throws
 * is logged at WARN and does not change the result of the operation. Oracle and issuance
 * calls happen while the lock is held and should return promptly.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * MintGate gate = MintGate.builder()
 *     .owner(owner)
 *     .oracle(oracle)
 *     .issuance(issuance)
 *     .events(new LoggingEventSink())
 *     .options(MintGateOptions.builder().asset(asset).build())
 *     .build();
 *
 * gate.selfMint(holder).orThrow();
 * }</pre>
 *
 * @see MintGateOptions
 * @see LedgerSnapshot
 */
public final class MintGate {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final String name;
    private final String symbol;
    private final AuthorizationRegistry authorization;
    private final EligibilityGate eligibility;
    private final TokenRegistry tokens;
    private final IssuanceLedger ledger;
    private final CollectionMinter collection;
    private final Issuer issuer;

    private MintGate(
            Builder builder, Address owner, Collection<Address> admins, MintGateOptions options, Address asset) {
        EventSink events = new GuardedEventSink(builder.events);
        this.name = options.name();
        this.symbol = options.symbol();
        this.authorization = new AuthorizationRegistry(owner, admins, events);
        this.eligibility = new EligibilityGate(
                builder.oracle, authorization, events, asset, options.requiredBalance());
        this.tokens = new TokenRegistry(authorization, events);
        this.issuer = new Issuer(builder.issuance, tokens, events);
        this.ledger = new IssuanceLedger(
                authorization, eligibility, issuer, events, options.mintableTokenId(), options.mintQuantity());
        this.collection = new CollectionMinter(authorization, issuer);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------------------
    // Collection
    // ---------------------------------------------------------------------------------

    public String name() {
        return name;
    }

    public String symbol() {
        return symbol;
    }

    // ---------------------------------------------------------------------------------
    // Authorization
    // ---------------------------------------------------------------------------------

    public Address owner() {
        return read(authorization::owner);
    }

    public boolean isOwner(Address caller) {
        return read(() -> authorization.isOwner(caller));
    }

    /**
     * Owner or admin.
     */
    public boolean isAuthorized(Address caller) {
        return read(() -> authorization.isAuthorized(caller));
    }

    /**
     * Admin-set membership. The owner is only reported as an admin if it was added
     * before becoming owner.
     */
    public boolean isAdmin(Address candidate) {
        return read(() -> authorization.isAdmin(candidate));
    }

    public int adminCount() {
        return read(authorization::adminCount);
    }

    public Set<Address> admins() {
        return read(authorization::admins);
    }

    /**
     * Adds an admin. Refusals, in check order: {@code UNAUTHORIZED} unless the caller is
     * the owner, {@code INVALID_ADDRESS} for the null identity, {@code ALREADY_ADMIN},
     * {@code OWNER_ALREADY_ADMIN}.
     */
    public Outcome<AdminAdded> addAdmin(Address caller, Address admin) {
        return write(() -> authorization.addAdmin(caller, admin));
    }

    /**
     * Removes an admin. Refusals: {@code UNAUTHORIZED}, {@code NOT_ADMIN}.
     */
    public Outcome<AdminRemoved> removeAdmin(Address caller, Address admin) {
        return write(() -> authorization.removeAdmin(caller, admin));
    }

    /**
     * Hands ownership to {@code newOwner} without touching the admin set.
     * Refusals: {@code UNAUTHORIZED}, {@code INVALID_ADDRESS}.
     */
    public Outcome<OwnershipTransferred> transferOwnership(Address caller, Address newOwner) {
        return write(() -> authorization.transferOwnership(caller, newOwner));
    }

    // ---------------------------------------------------------------------------------
    // Eligibility
    // ---------------------------------------------------------------------------------

    public Address asset() {
        return read(eligibility::asset);
    }

    public BigInteger requiredBalance() {
        return read(eligibility::requiredBalance);
    }

    /**
     * @throws OracleException if the oracle fails
     */
    public boolean hasSufficientBalance(Address holder) {
        return read(() -> eligibility.hasSufficientBalance(holder));
    }

    /**
     * @throws OracleException if the oracle fails
     */
    public BigInteger describeBalance(Address holder) {
        return read(() -> eligibility.describeBalance(holder));
    }

    public Outcome<AssetUpdated> updateAsset(Address caller, Address newAsset) {
        return write(() -> eligibility.updateAsset(caller, newAsset));
    }

    /**
     * @throws IllegalArgumentException if {@code newThreshold} is negative
     */
    public Outcome<RequiredBalanceUpdated> updateThreshold(Address caller, BigInteger newThreshold) {
        return write(() -> eligibility.updateThreshold(caller, newThreshold));
    }

    // ---------------------------------------------------------------------------------
    // Token registry
    // ---------------------------------------------------------------------------------

    public boolean exists(TokenId tokenId) {
        return read(() -> tokens.exists(tokenId));
    }

    public List<TokenId> existingTokens() {
        return read(tokens::existingTokens);
    }

    /**
     * Sets the metadata URI prefix of a token, existing or not. Owner or admin only.
     */
    public Outcome<UriSet> setURI(Address caller, TokenId tokenId, String prefix) {
        return write(() -> tokens.setURI(caller, tokenId, prefix));
    }

    /**
     * The raw prefix as set, or {@code ""}.
     */
    public String tokenUriPrefix(TokenId tokenId) {
        return read(() -> tokens.uriPrefix(tokenId));
    }

    /**
     * {@code prefix + decimal(tokenId) + ".json"}, or {@code UNKNOWN_TOKEN} if nothing of
     * the token was ever issued.
     */
    public Outcome<String> resolveURI(TokenId tokenId) {
        Objects.requireNonNull(tokenId, "tokenId");
        return read(() -> tokens.resolveURI(tokenId));
    }

    // ---------------------------------------------------------------------------------
    // Issuance ledger
    // ---------------------------------------------------------------------------------

    public TokenId mintableTokenId() {
        return read(ledger::mintableTokenId);
    }

    public BigInteger mintQuantity() {
        return read(ledger::mintQuantity);
    }

    public BigInteger totalIssued() {
        return read(ledger::totalIssued);
    }

    public boolean hasMinted(Address identity) {
        return read(() -> ledger.hasMinted(identity));
    }

    public MintState mintState(Address identity) {
        return read(() -> ledger.mintState(identity));
    }

    /**
     * Whether {@link #selfMint} would currently succeed for {@code identity}.
     *
     * @throws OracleException if the oracle fails
     */
    public boolean canSelfMint(Address identity) {
        return read(() -> ledger.canSelfMint(identity));
    }

    /**
     * Issues {@link #mintQuantity()} units of {@link #mintableTokenId()} to the caller.
     * Refusals: {@code ALREADY_MINTED}, {@code INSUFFICIENT_BALANCE}.
     *
     * @throws OracleException   if the oracle fails
     * @throws IssuanceException if the issuance primitive fails; the caller stays unminted
     */
    public Outcome<TokenMinted> selfMint(Address caller) {
        return write(() -> ledger.selfMint(caller));
    }

    /**
     * Owner-only issuance to each recipient, without the balance check. Already-minted
     * recipients are skipped. See {@link BatchMintResult} for the per-entry semantics.
     */
    public Outcome<BatchMintResult> batchMint(Address caller, List<Address> recipients) {
        return write(() -> ledger.batchMint(caller, recipients));
    }

    public Outcome<MintableTokenIdUpdated> updateMintableTokenId(Address caller, TokenId newTokenId) {
        return write(() -> ledger.updateMintableTokenId(caller, newTokenId));
    }

    /**
     * Refusals: {@code UNAUTHORIZED}, {@code INVALID_QUANTITY} below 1.
     */
    public Outcome<MintQuantityUpdated> updateMintQuantity(Address caller, BigInteger newQuantity) {
        return write(() -> ledger.updateMintQuantity(caller, newQuantity));
    }

    // ---------------------------------------------------------------------------------
    // Collection mints
    // ---------------------------------------------------------------------------------

    /**
     * Owner or admin issuance of any token, outside the one-time ledger.
     *
     * @throws IssuanceException if the issuance primitive fails
     */
    public Outcome<TokenMinted> mint(Address caller, Address to, TokenId tokenId, BigInteger amount, byte[] data) {
        return write(() -> collection.mint(caller, to, tokenId, amount, data));
    }

    /**
     * Batch form of {@link #mint}. Every pair is validated before the first is issued.
     *
     * @throws IssuanceException if the issuance primitive fails part-way; earlier pairs
     *                           stay issued
     */
    public Outcome<List<TokenMinted>> mintBatch(
            Address caller, Address to, List<TokenId> tokenIds, List<BigInteger> amounts, byte[] data) {
        return write(() -> collection.mintBatch(caller, to, tokenIds, amounts, data));
    }

    /**
     * Units of {@code tokenId} held by {@code holder}, as reported by the issuance
     * primitive.
     */
    public BigInteger balanceOfToken(Address holder, TokenId tokenId) {
        Objects.requireNonNull(holder, "holder");
        Objects.requireNonNull(tokenId, "tokenId");
        return read(() -> issuer.balanceOfToken(holder, tokenId));
    }

    // ---------------------------------------------------------------------------------
    // Export
    // ---------------------------------------------------------------------------------

    public LedgerSnapshot snapshot() {
        return read(() -> {
            List<LedgerSnapshot.UriEntry> uris = new ArrayList<>();
            for (Map.Entry<TokenId, String> e : tokens.uriPrefixes().entrySet()) {
                uris.add(new LedgerSnapshot.UriEntry(e.getKey(), e.getValue()));
            }
            return new LedgerSnapshot(
                    name,
                    symbol,
                    authorization.owner(),
                    List.copyOf(authorization.admins()),
                    eligibility.asset(),
                    eligibility.requiredBalance(),
                    ledger.mintableTokenId(),
                    ledger.mintQuantity(),
                    ledger.mintedAddresses(),
                    ledger.totalIssued(),
                    tokens.existingTokens(),
                    uris);
        });
    }

    @Override
    public String toString() {
        return "MintGate{name=" + name + ", symbol=" + symbol + '}';
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Builder for {@link MintGate}.
     *
     * <p>{@link #oracle} and {@link #issuance} are always required. A fresh gate also
     * needs an {@link #owner} and an asset in its {@link #options}; a gate rebuilt with
     * {@link #restore} takes both, and the rest of its state, from the snapshot.
     */
    public static final class Builder {
        private @Nullable Address owner;
        private @Nullable BalanceOracle oracle;
        private @Nullable IssuancePrimitive issuance;
        private EventSink events = EventSink.noop();
        private MintGateOptions options = MintGateOptions.defaults();
        private Collection<Address> admins = List.of();
        private @Nullable LedgerSnapshot snapshot;

        private Builder() {
        }

        public Builder owner(Address owner) {
            this.owner = Objects.requireNonNull(owner, "owner");
            return this;
        }

        public Builder oracle(BalanceOracle oracle) {
            this.oracle = Objects.requireNonNull(oracle, "oracle");
            return this;
        }

        public Builder issuance(IssuancePrimitive issuance) {
            this.issuance = Objects.requireNonNull(issuance, "issuance");
            return this;
        }

        /**
         * Where observations go. Defaults to {@link EventSink#noop()}.
         */
        public Builder events(EventSink events) {
            this.events = Objects.requireNonNull(events, "events");
            return this;
        }

        public Builder options(MintGateOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        /**
         * Initial admins. Ignored when restoring.
         */
        public Builder admins(Collection<Address> admins) {
            this.admins = List.copyOf(Objects.requireNonNull(admins, "admins"));
            return this;
        }

        /**
         * Rebuilds the gate from an export. Owner, admins and options set on this builder
         * are replaced by the snapshot's values.
         */
        public Builder restore(LedgerSnapshot snapshot) {
            this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
            return this;
        }

        /**
         * @throws IllegalStateException    if a required collaborator, the owner or the
         *                                  asset is missing
         * @throws IllegalArgumentException if the owner, an admin or the asset is the
         *                                  null identity
         */
        public MintGate build() {
            if (oracle == null) {
                throw new IllegalStateException("oracle is required");
            }
            if (issuance == null) {
                throw new IllegalStateException("issuance is required");
            }
            if (snapshot != null) {
                return fromSnapshot(snapshot);
            }
            if (owner == null) {
                throw new IllegalStateException("owner is required");
            }
            Address asset = options.asset();
            if (asset == null) {
                throw new IllegalStateException("asset is required");
            }
            return new MintGate(this, owner, admins, options, asset);
        }

        private MintGate fromSnapshot(LedgerSnapshot s) {
            MintGateOptions restored = MintGateOptions.builder()
                    .name(s.name())
                    .symbol(s.symbol())
                    .asset(s.asset())
                    .requiredBalance(s.requiredBalance())
                    .mintableTokenId(s.mintableTokenId())
                    .mintQuantity(s.mintQuantity())
                    .build();
            MintGate gate = new MintGate(this, s.owner(), s.admins(), restored, s.asset());
            gate.ledger.restore(s.minted(), s.totalIssued());
            Map<TokenId, String> prefixes = new LinkedHashMap<>();
            for (LedgerSnapshot.UriEntry uri : s.uris()) {
                prefixes.put(uri.tokenId(), uri.prefix());
            }
            gate.tokens.restore(s.existingTokens(), prefixes);
            return gate;
        }
    }
}
