// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.mintgate.core.event.TokenMinted;
import sh.mintgate.core.types.Address;

/**
 * Per-entry report of a batch issuance.
 *
 * <p>A batch is not atomic as a whole. Each entry is applied or refused on its own, in
 * input order, and entries applied before a failed one stay applied. Callers that need
 * all-or-nothing behaviour must inspect {@link #failed()} and react themselves.
 *
 * @param entries one entry per input address, in input order
 */
public record BatchMintResult(List<Entry> entries) {

    public BatchMintResult {
        Objects.requireNonNull(entries, "entries");
        entries = List.copyOf(entries);
    }

    /**
     * What happened to one input address.
     */
    public enum Status {
        /** Units were issued and the address is now minted. */
        MINTED,
        /** The address had already minted; nothing happened and no event was emitted. */
        SKIPPED,
        /** The entry could not be applied; the address stays unminted. */
        FAILED
    }

    /**
     * The outcome for one input address.
     *
     * @param recipient the input address
     * @param status    what happened
     * @param event     the emitted observation when {@code status} is MINTED
     * @param failure   why the entry failed when {@code status} is FAILED
     */
    public record Entry(
            Address recipient,
            Status status,
            @Nullable TokenMinted event,
            @Nullable String failure) {

        public Entry {
            Objects.requireNonNull(recipient, "recipient");
            Objects.requireNonNull(status, "status");
        }

        static Entry minted(TokenMinted event) {
            return new Entry(event.to(), Status.MINTED, event, null);
        }

        static Entry skipped(Address recipient) {
            return new Entry(recipient, Status.SKIPPED, null, null);
        }

        static Entry failed(Address recipient, String failure) {
            return new Entry(recipient, Status.FAILED, null, failure);
        }
    }

    public List<Entry> minted() {
        return withStatus(Status.MINTED);
    }

    public List<Entry> skipped() {
        return withStatus(Status.SKIPPED);
    }

    public List<Entry> failed() {
        return withStatus(Status.FAILED);
    }

    public boolean hasFailures() {
        return entries.stream().anyMatch(e -> e.status() == Status.FAILED);
    }

    /**
     * Sum of units issued by this batch.
     */
    public BigInteger issuedQuantity() {
        return entries.stream()
                .filter(e -> e.event() != null)
                .map(e -> e.event().quantity())
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    private List<Entry> withStatus(Status status) {
        return entries.stream().filter(e -> e.status() == status).toList();
    }
}
