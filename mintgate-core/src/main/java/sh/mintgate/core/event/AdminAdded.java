// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.event;

import java.util.Objects;

import sh.mintgate.core.types.Address;

/**
 * An address joined the admin set.
 *
 * @param admin the new admin
 */
public record AdminAdded(Address admin) implements LedgerEvent {

    public AdminAdded {
        Objects.requireNonNull(admin, "admin");
    }
}
