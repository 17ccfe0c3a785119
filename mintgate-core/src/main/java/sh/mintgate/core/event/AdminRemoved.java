// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.event;

import java.util.Objects;

import sh.mintgate.core.types.Address;

/**
 * An address left the admin set.
 *
 * @param admin the removed admin
 */
public record AdminRemoved(Address admin) implements LedgerEvent {

    public AdminRemoved {
        Objects.requireNonNull(admin, "admin");
    }
}
