// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.event;

import java.math.BigInteger;
import java.util.Objects;

/**
 * The per-address issuance quantity changed.
 *
 * @param oldQuantity the previous quantity
 * @param newQuantity the quantity issued from now on
 */
public record MintQuantityUpdated(BigInteger oldQuantity, BigInteger newQuantity) implements LedgerEvent {

    public MintQuantityUpdated {
        Objects.requireNonNull(oldQuantity, "oldQuantity");
        Objects.requireNonNull(newQuantity, "newQuantity");
    }
}
