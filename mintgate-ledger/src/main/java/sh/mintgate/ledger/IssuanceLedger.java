// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import sh.mintgate.core.DebugLogger;
import sh.mintgate.core.LogFormatter;
import sh.mintgate.core.error.IssuanceException;
import sh.mintgate.core.error.MintError;
import sh.mintgate.core.error.Outcome;
import sh.mintgate.core.event.EventSink;
import sh.mintgate.core.event.MintQuantityUpdated;
import sh.mintgate.core.event.MintableTokenIdUpdated;
import sh.mintgate.core.event.TokenMinted;
import sh.mintgate.core.types.Address;
import sh.mintgate.core.types.TokenId;

/**
 * One-time issuance per address.
 *
 * <p>Each address moves from {@link MintState#NEVER_MINTED} to {@link MintState#MINTED} at
 * most once, either through a self-service mint that passes the balance check or through
 * an owner batch that bypasses it. {@code totalIssued} only grows, by the quantity that
 * was configured when each mint happened.
 *
 * <p>A self-service mint is atomic: the issuance primitive runs before any ledger field
 * changes, so a primitive failure leaves the address unminted and the counter untouched.
 *
 * <p>Not thread-safe; {@link MintGate} serializes access.
 */
final class IssuanceLedger {

    private static final byte[] NO_DATA = new byte[0];

    private final AuthorizationRegistry authorization;
    private final EligibilityGate eligibility;
    private final Issuer issuer;
    private final EventSink events;

    private final Set<Address> minted = new LinkedHashSet<>();
    private BigInteger totalIssued = BigInteger.ZERO;
    private TokenId mintableTokenId;
    private BigInteger mintQuantity;

    IssuanceLedger(
            AuthorizationRegistry authorization,
            EligibilityGate eligibility,
            Issuer issuer,
            EventSink events,
            TokenId mintableTokenId,
            BigInteger mintQuantity) {
        this.authorization = Objects.requireNonNull(authorization, "authorization");
        this.eligibility = Objects.requireNonNull(eligibility, "eligibility");
        this.issuer = Objects.requireNonNull(issuer, "issuer");
        this.events = Objects.requireNonNull(events, "events");
        this.mintableTokenId = Objects.requireNonNull(mintableTokenId, "mintableTokenId");
        Objects.requireNonNull(mintQuantity, "mintQuantity");
        if (mintQuantity.signum() <= 0) {
            throw new IllegalArgumentException("mintQuantity must be at least 1");
        }
        this.mintQuantity = mintQuantity;
    }

    TokenId mintableTokenId() {
        return mintableTokenId;
    }

    BigInteger mintQuantity() {
        return mintQuantity;
    }

    BigInteger totalIssued() {
        return totalIssued;
    }

    boolean hasMinted(Address identity) {
        return minted.contains(Objects.requireNonNull(identity, "identity"));
    }

    MintState mintState(Address identity) {
        return hasMinted(identity) ? MintState.MINTED : MintState.NEVER_MINTED;
    }

    /**
     * Minted addresses in the order they minted.
     */
    List<Address> mintedAddresses() {
        return List.copyOf(minted);
    }

    /**
     * Side-effect free evaluation of the self-service preconditions.
     */
    boolean canSelfMint(Address identity) {
        return !hasMinted(identity) && eligibility.hasSufficientBalance(identity);
    }

    /**
     * @throws IssuanceException if the primitive fails; nothing was recorded
     */
    Outcome<TokenMinted> selfMint(Address caller) {
        Objects.requireNonNull(caller, "caller");
        if (minted.contains(caller)) {
            return Rejections.mint("selfMint", caller, MintError.ALREADY_MINTED, caller.value());
        }
        BigInteger balance = eligibility.describeBalance(caller);
        if (balance.compareTo(eligibility.requiredBalance()) < 0) {
            return Rejections.mint("selfMint", caller, MintError.INSUFFICIENT_BALANCE,
                    "balance=" + balance + " required=" + eligibility.requiredBalance());
        }
        return Outcome.success(issueOnce(caller));
    }

    /**
     * Owner-only issuance that skips the balance check.
     *
     * <p>Entries are processed in order. Already-minted addresses are skipped without an
     * event. An entry whose issuance fails is reported as failed and the batch moves on;
     * earlier entries stay minted.
     */
    Outcome<BatchMintResult> batchMint(Address caller, List<Address> recipients) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(recipients, "recipients");
        for (int i = 0; i < recipients.size(); i++) {
            Objects.requireNonNull(recipients.get(i), "recipients[" + i + "]");
        }
        if (!authorization.isOwner(caller)) {
            return Rejections.mint("batchMint", caller, MintError.UNAUTHORIZED, "only the owner can batch mint");
        }

        long startNanos = System.nanoTime();
        List<BatchMintResult.Entry> entries = new ArrayList<>(recipients.size());
        for (Address recipient : recipients) {
            if (minted.contains(recipient)) {
                DebugLogger.logMint(LogFormatter.formatSkip(recipient, MintError.ALREADY_MINTED.name()));
                entries.add(BatchMintResult.Entry.skipped(recipient));
                continue;
            }
            if (recipient.isZero()) {
                DebugLogger.logMint(LogFormatter.formatSkip(recipient, MintError.INVALID_ADDRESS.name()));
                entries.add(BatchMintResult.Entry.failed(recipient, MintError.INVALID_ADDRESS.description()));
                continue;
            }
            try {
                entries.add(BatchMintResult.Entry.minted(issueOnce(recipient)));
            } catch (IssuanceException e) {
                DebugLogger.logMint(LogFormatter.formatIssuanceFailure(recipient, e.tokenId(), e.getMessage()));
                entries.add(BatchMintResult.Entry.failed(recipient, e.getMessage()));
            }
        }

        BatchMintResult result = new BatchMintResult(entries);
        long micros = TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - startNanos);
        DebugLogger.logMint(LogFormatter.formatBatch(recipients.size(),
                result.minted().size(), result.skipped().size(), result.failed().size(), micros));
        return Outcome.success(result);
    }

    Outcome<MintableTokenIdUpdated> updateMintableTokenId(Address caller, TokenId newTokenId) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(newTokenId, "newTokenId");
        if (!authorization.isOwner(caller)) {
            return Rejections.admin("updateMintableTokenId", caller, MintError.UNAUTHORIZED,
                    "only the owner can change the mintable token");
        }

        TokenId previous = mintableTokenId;
        mintableTokenId = newTokenId;
        DebugLogger.logAdmin(LogFormatter.formatConfig("mintableTokenId", previous, newTokenId));
        MintableTokenIdUpdated event = new MintableTokenIdUpdated(previous, newTokenId);
        events.emit(event);
        return Outcome.success(event);
    }

    Outcome<MintQuantityUpdated> updateMintQuantity(Address caller, BigInteger newQuantity) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(newQuantity, "newQuantity");
        if (!authorization.isOwner(caller)) {
            return Rejections.admin("updateMintQuantity", caller, MintError.UNAUTHORIZED,
                    "only the owner can change the mint quantity");
        }
        if (newQuantity.signum() <= 0) {
            return Rejections.admin("updateMintQuantity", caller, MintError.INVALID_QUANTITY, newQuantity.toString());
        }

        BigInteger previous = mintQuantity;
        mintQuantity = newQuantity;
        DebugLogger.logAdmin(LogFormatter.formatConfig("mintQuantity", previous, newQuantity));
        MintQuantityUpdated event = new MintQuantityUpdated(previous, newQuantity);
        events.emit(event);
        return Outcome.success(event);
    }

    void restore(Collection<Address> mintedAddresses, BigInteger issued) {
        Objects.requireNonNull(issued, "totalIssued");
        if (issued.signum() < 0) {
            throw new IllegalArgumentException("totalIssued must be non-negative");
        }
        for (Address address : mintedAddresses) {
            minted.add(Objects.requireNonNull(address, "minted address"));
        }
        totalIssued = issued;
    }

    private TokenMinted issueOnce(Address recipient) {
        TokenId tokenId = mintableTokenId;
        BigInteger quantity = mintQuantity;

        issuer.issue(recipient, tokenId, quantity, NO_DATA);

        minted.add(recipient);
        totalIssued = totalIssued.add(quantity);
        TokenMinted event = issuer.record(recipient, tokenId, quantity);
        DebugLogger.logMint(LogFormatter.formatMint(recipient, tokenId, quantity, totalIssued));
        return event;
    }
}
