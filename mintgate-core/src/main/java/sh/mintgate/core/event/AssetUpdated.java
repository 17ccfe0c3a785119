// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.event;

import java.util.Objects;

import sh.mintgate.core.types.Address;

/**
 * The balance-bearing asset used for eligibility changed.
 *
 * @param oldAsset the previous asset
 * @param newAsset the asset used from now on
 */
public record AssetUpdated(Address oldAsset, Address newAsset) implements LedgerEvent {

    public AssetUpdated {
        Objects.requireNonNull(oldAsset, "oldAsset");
        Objects.requireNonNull(newAsset, "newAsset");
    }
}
