// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import sh.mintgate.core.DebugLogger;
import sh.mintgate.core.LogFormatter;
import sh.mintgate.core.error.MintError;
import sh.mintgate.core.error.Outcome;
import sh.mintgate.core.event.AdminAdded;
import sh.mintgate.core.event.AdminRemoved;
import sh.mintgate.core.event.EventSink;
import sh.mintgate.core.event.OwnershipTransferred;
import sh.mintgate.core.types.Address;

/**
 * Owner identity plus the admin set.
 *
 * <p>Two privilege levels: {@link #isAuthorized} (owner or admin) gates URI writes and
 * collection mints, {@link #isOwner} gates everything that changes who may act or what
 * gets issued, including batch issuance.
 *
 * <p>Ownership transfer leaves the admin set alone. A former owner does not become an
 * admin, and a new owner that was an admin stays in the set.
 *
 * <p>Not thread-safe; {@link MintGate} serializes access.
 */
final class AuthorizationRegistry {

    private final EventSink events;
    private final Set<Address> admins = new LinkedHashSet<>();
    private Address owner;

    AuthorizationRegistry(Address owner, EventSink events) {
        this(owner, Set.of(), events);
    }

    AuthorizationRegistry(Address owner, Collection<Address> admins, EventSink events) {
        this.owner = requireRealIdentity(owner, "owner");
        this.events = Objects.requireNonNull(events, "events");
        for (Address admin : admins) {
            this.admins.add(requireRealIdentity(admin, "admin"));
        }
    }

    Address owner() {
        return owner;
    }

    boolean isOwner(Address caller) {
        return owner.equals(caller);
    }

    boolean isAuthorized(Address caller) {
        return isOwner(caller) || admins.contains(caller);
    }

    /**
     * Admin-set membership only; the owner is not reported as an admin.
     */
    boolean isAdmin(Address candidate) {
        return admins.contains(candidate);
    }

    int adminCount() {
        return admins.size();
    }

    /**
     * Immutable copy in insertion order.
     */
    Set<Address> admins() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(admins));
    }

    Outcome<AdminAdded> addAdmin(Address caller, Address admin) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(admin, "admin");
        if (!isOwner(caller)) {
            return Rejections.admin("addAdmin", caller, MintError.UNAUTHORIZED, "only the owner can add admins");
        }
        if (admin.isZero()) {
            return Rejections.admin("addAdmin", caller, MintError.INVALID_ADDRESS, admin.value());
        }
        if (admins.contains(admin)) {
            return Rejections.admin("addAdmin", caller, MintError.ALREADY_ADMIN, admin.value());
        }
        if (isOwner(admin)) {
            return Rejections.admin("addAdmin", caller, MintError.OWNER_ALREADY_ADMIN, admin.value());
        }

        admins.add(admin);
        DebugLogger.logAdmin(LogFormatter.formatAdmin("added", admin, admins.size()));
        AdminAdded event = new AdminAdded(admin);
        events.emit(event);
        return Outcome.success(event);
    }

    Outcome<AdminRemoved> removeAdmin(Address caller, Address admin) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(admin, "admin");
        if (!isOwner(caller)) {
            return Rejections.admin("removeAdmin", caller, MintError.UNAUTHORIZED, "only the owner can remove admins");
        }
        if (!admins.contains(admin)) {
            return Rejections.admin("removeAdmin", caller, MintError.NOT_ADMIN, admin.value());
        }

        admins.remove(admin);
        DebugLogger.logAdmin(LogFormatter.formatAdmin("removed", admin, admins.size()));
        AdminRemoved event = new AdminRemoved(admin);
        events.emit(event);
        return Outcome.success(event);
    }

    Outcome<OwnershipTransferred> transferOwnership(Address caller, Address newOwner) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(newOwner, "newOwner");
        if (!isOwner(caller)) {
            return Rejections.admin("transferOwnership", caller, MintError.UNAUTHORIZED,
                    "only the owner can transfer ownership");
        }
        if (newOwner.isZero()) {
            return Rejections.admin("transferOwnership", caller, MintError.INVALID_ADDRESS, newOwner.value());
        }

        Address previous = owner;
        owner = newOwner;
        DebugLogger.logAdmin(LogFormatter.formatOwnership(previous, newOwner));
        OwnershipTransferred event = new OwnershipTransferred(previous, newOwner);
        events.emit(event);
        return Outcome.success(event);
    }

    private static Address requireRealIdentity(Address address, String role) {
        Objects.requireNonNull(address, role);
        if (address.isZero()) {
            throw new IllegalArgumentException(role + " cannot be the null identity");
        }
        return address;
    }
}
