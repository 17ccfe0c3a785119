// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import static org.junit.jupiter.api.Assertions.*;
import static sh.mintgate.ledger.Fixtures.*;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import sh.mintgate.core.error.MintError;
import sh.mintgate.core.error.Outcome;
import sh.mintgate.core.event.AdminAdded;
import sh.mintgate.core.event.AdminRemoved;
import sh.mintgate.core.event.OwnershipTransferred;
import sh.mintgate.core.event.RecordingEventSink;
import sh.mintgate.core.types.Address;

class AuthorizationRegistryTest {

    private RecordingEventSink events;
    private AuthorizationRegistry registry;

    @BeforeEach
    void setUp() {
        events = new RecordingEventSink();
        registry = new AuthorizationRegistry(OWNER, events);
    }

    @Test
    void ownerIsAuthorizedButNotAnAdmin() {
        assertTrue(registry.isOwner(OWNER));
        assertTrue(registry.isAuthorized(OWNER));
        assertFalse(registry.isAdmin(OWNER));
        assertEquals(0, registry.adminCount());
    }

    @Test
    void addAdminGrantsAuthorizationAndEmits() {
        Outcome<AdminAdded> outcome = registry.addAdmin(OWNER, ADMIN);

        assertTrue(outcome.isSuccess());
        assertTrue(registry.isAdmin(ADMIN));
        assertTrue(registry.isAuthorized(ADMIN));
        assertFalse(registry.isOwner(ADMIN));
        assertEquals(1, registry.adminCount());
        assertEquals(List.of(new AdminAdded(ADMIN)), events.events());
    }

    @Test
    @DisplayName("Check order: caller, null identity, membership, owner")
    void addAdminRefusals() {
        registry.addAdmin(OWNER, ADMIN);
        events.clear();

        assertEquals(MintError.UNAUTHORIZED, registry.addAdmin(ADMIN, Address.ZERO).error().orElseThrow());
        assertEquals(MintError.INVALID_ADDRESS, registry.addAdmin(OWNER, Address.ZERO).error().orElseThrow());
        assertEquals(MintError.ALREADY_ADMIN, registry.addAdmin(OWNER, ADMIN).error().orElseThrow());
        assertEquals(MintError.OWNER_ALREADY_ADMIN, registry.addAdmin(OWNER, OWNER).error().orElseThrow());

        assertEquals(1, registry.adminCount());
        assertEquals(0, events.size());
    }

    @Test
    void removeAdminRefusals() {
        assertEquals(MintError.NOT_ADMIN, registry.removeAdmin(OWNER, ADMIN).error().orElseThrow());

        registry.addAdmin(OWNER, ADMIN);
        assertEquals(MintError.UNAUTHORIZED, registry.removeAdmin(ADMIN, ADMIN).error().orElseThrow());
        assertTrue(registry.isAdmin(ADMIN));
    }

    @Test
    void addRemoveReAddLeavesOneAdmin() {
        assertTrue(registry.addAdmin(OWNER, ADMIN).isSuccess());
        assertTrue(registry.removeAdmin(OWNER, ADMIN).isSuccess());
        assertFalse(registry.isAuthorized(ADMIN));
        assertTrue(registry.addAdmin(OWNER, ADMIN).isSuccess());

        assertEquals(1, registry.adminCount());
        assertEquals(Set.of(ADMIN), registry.admins());
        assertEquals(List.of(new AdminAdded(ADMIN), new AdminRemoved(ADMIN), new AdminAdded(ADMIN)), events.events());
    }

    @Test
    void adminCannotManageAdmins() {
        registry.addAdmin(OWNER, ADMIN);

        assertEquals(MintError.UNAUTHORIZED, registry.addAdmin(ADMIN, ALICE).error().orElseThrow());
        assertFalse(registry.isAdmin(ALICE));
    }

    @Test
    void transferOwnershipLeavesAdminSetAlone() {
        registry.addAdmin(OWNER, ADMIN);

        Outcome<OwnershipTransferred> outcome = registry.transferOwnership(OWNER, ADMIN);

        assertEquals(new OwnershipTransferred(OWNER, ADMIN), outcome.orThrow());
        assertEquals(ADMIN, registry.owner());
        assertTrue(registry.isAdmin(ADMIN));
        assertEquals(1, registry.adminCount());
        assertFalse(registry.isAuthorized(OWNER));
        assertEquals(MintError.UNAUTHORIZED, registry.addAdmin(OWNER, ALICE).error().orElseThrow());
    }

    @Test
    void transferOwnershipToNullIdentityIsRefused() {
        assertEquals(MintError.INVALID_ADDRESS, registry.transferOwnership(OWNER, Address.ZERO).error().orElseThrow());
        assertEquals(MintError.UNAUTHORIZED, registry.transferOwnership(STRANGER, ALICE).error().orElseThrow());
        assertEquals(OWNER, registry.owner());
    }

    @Test
    void constructionRejectsNullIdentities() {
        assertThrows(IllegalArgumentException.class, () -> new AuthorizationRegistry(Address.ZERO, events));
        assertThrows(IllegalArgumentException.class,
                () -> new AuthorizationRegistry(OWNER, List.of(ADMIN, Address.ZERO), events));
        assertThrows(NullPointerException.class, () -> new AuthorizationRegistry(null, events));
    }
}
