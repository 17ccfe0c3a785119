// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import static org.junit.jupiter.api.Assertions.*;
import static sh.mintgate.ledger.Fixtures.*;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.mintgate.core.error.MintError;
import sh.mintgate.core.event.RecordingEventSink;
import sh.mintgate.core.types.TokenId;
import sh.mintgate.ledger.memory.InMemoryBalanceOracle;
import sh.mintgate.ledger.memory.InMemoryIssuance;

class LedgerSnapshotTest {

    private InMemoryBalanceOracle oracle;
    private InMemoryIssuance issuance;
    private MintGate gate;

    @BeforeEach
    void setUp() {
        oracle = new InMemoryBalanceOracle();
        issuance = new InMemoryIssuance();
        gate = MintGate.builder()
                .owner(OWNER)
                .oracle(oracle)
                .issuance(issuance)
                .options(MintGateOptions.builder()
                        .name("Members Pass")
                        .symbol("PASS")
                        .asset(ASSET)
                        .requiredBalance(THRESHOLD)
                        .build())
                .build();

        gate.addAdmin(OWNER, ADMIN).orThrow();
        gate.setURI(ADMIN, TokenId.ZERO, "ipfs://pass/").orThrow();
        gate.setURI(ADMIN, TokenId.of(9), "ipfs://staged/").orThrow();
        oracle.setBalance(ASSET, ALICE, THRESHOLD);
        gate.selfMint(ALICE).orThrow();
        gate.updateMintQuantity(OWNER, units(2)).orThrow();
        gate.batchMint(OWNER, List.of(BOB)).orThrow();
    }

    @Test
    void snapshotCapturesEveryTable() {
        LedgerSnapshot snapshot = gate.snapshot();

        assertEquals("Members Pass", snapshot.name());
        assertEquals(OWNER, snapshot.owner());
        assertEquals(List.of(ADMIN), snapshot.admins());
        assertEquals(ASSET, snapshot.asset());
        assertEquals(THRESHOLD, snapshot.requiredBalance());
        assertEquals(units(2), snapshot.mintQuantity());
        assertEquals(List.of(ALICE, BOB), snapshot.minted());
        assertEquals(units(3), snapshot.totalIssued());
        assertEquals(List.of(TokenId.ZERO), snapshot.existingTokens());
        assertEquals(List.of(
                new LedgerSnapshot.UriEntry(TokenId.ZERO, "ipfs://pass/"),
                new LedgerSnapshot.UriEntry(TokenId.of(9), "ipfs://staged/")), snapshot.uris());
    }

    @Test
    void jsonRoundTripPreservesSnapshot() {
        LedgerSnapshot snapshot = gate.snapshot();

        String json = snapshot.toJson();

        assertTrue(json.contains("\"owner\" : \"" + OWNER.value() + "\""));
        assertEquals(snapshot, LedgerSnapshot.fromJson(json));
    }

    @Test
    void restoredGateContinuesWhereTheOriginalStopped() {
        RecordingEventSink events = new RecordingEventSink();
        MintGate restored = MintGate.builder()
                .oracle(oracle)
                .issuance(issuance)
                .events(events)
                .restore(LedgerSnapshot.fromJson(gate.snapshot().toJson()))
                .build();

        assertEquals("PASS", restored.symbol());
        assertTrue(restored.isAdmin(ADMIN));
        assertEquals(units(3), restored.totalIssued());
        assertEquals("ipfs://pass/0.json", restored.resolveURI(TokenId.ZERO).orThrow());
        assertEquals(MintError.UNKNOWN_TOKEN, restored.resolveURI(TokenId.of(9)).error().orElseThrow());
        assertEquals(MintError.ALREADY_MINTED, restored.selfMint(ALICE).error().orElseThrow());
        assertEquals(0, events.size());

        oracle.setBalance(ASSET, CAROL, THRESHOLD);
        restored.selfMint(CAROL).orThrow();
        assertEquals(units(5), restored.totalIssued());
        assertEquals(gate.snapshot().totalIssued(), units(3));
    }

    @Test
    void restoreIgnoresBuilderAdminsAndBuildsIndependentGates() {
        MintGate.Builder builder = MintGate.builder()
                .oracle(oracle)
                .issuance(issuance)
                .admins(List.of(CAROL))
                .restore(gate.snapshot());

        MintGate first = builder.build();
        first.addAdmin(OWNER, STRANGER).orThrow();
        MintGate second = builder.build();

        assertEquals(Set.of(ADMIN, STRANGER), first.admins());
        assertEquals(Set.of(ADMIN), second.admins());
        assertFalse(second.isAdmin(CAROL));
    }

    @Test
    void malformedJsonIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> LedgerSnapshot.fromJson("{\"name\": 1"));
        assertThrows(IllegalArgumentException.class, () -> LedgerSnapshot.fromJson("{\"name\": \"x\"}"));
    }

    @Test
    void unknownFieldsAreIgnored() {
        String json = gate.snapshot().toJson().replaceFirst("\\{", "{ \"exportedBy\" : \"ops\",");

        assertEquals(gate.snapshot(), LedgerSnapshot.fromJson(json));
    }

    @Test
    void snapshotListsAreImmutable() {
        LedgerSnapshot snapshot = gate.snapshot();

        assertThrows(UnsupportedOperationException.class, () -> snapshot.minted().add(CAROL));
        assertEquals(BigInteger.ONE.add(BigInteger.TWO), snapshot.totalIssued());
    }
}
