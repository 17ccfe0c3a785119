// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.event;

import java.math.BigInteger;
import java.util.Objects;

/**
 * The eligibility threshold changed.
 *
 * @param oldBalance the previous threshold
 * @param newBalance the threshold used from now on
 */
public record RequiredBalanceUpdated(BigInteger oldBalance, BigInteger newBalance) implements LedgerEvent {

    public RequiredBalanceUpdated {
        Objects.requireNonNull(oldBalance, "oldBalance");
        Objects.requireNonNull(newBalance, "newBalance");
    }
}
