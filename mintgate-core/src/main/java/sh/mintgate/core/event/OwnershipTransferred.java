// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.event;

import java.util.Objects;

import sh.mintgate.core.types.Address;

/**
 * The owner identity was replaced. The admin set is not touched by a transfer.
 *
 * @param previousOwner the owner before the transfer
 * @param newOwner      the owner after the transfer
 */
public record OwnershipTransferred(Address previousOwner, Address newOwner) implements LedgerEvent {

    public OwnershipTransferred {
        Objects.requireNonNull(previousOwner, "previousOwner");
        Objects.requireNonNull(newOwner, "newOwner");
    }
}
