// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.event;

/**
 * Observation emitted after a ledger state change commits.
 *
 * <p>Indexers consume these through an {@link EventSink}. Emission carries no
 * acknowledgement and never feeds back into ledger logic.
 */
public sealed interface LedgerEvent
        permits AdminAdded,
        AdminRemoved,
        OwnershipTransferred,
        TokenMinted,
        UriSet,
        AssetUpdated,
        RequiredBalanceUpdated,
        MintableTokenIdUpdated,
        MintQuantityUpdated {

    /**
     * Short event name, e.g. {@code AdminAdded}.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
