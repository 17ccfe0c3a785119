// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static sh.mintgate.ledger.Fixtures.*;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.mintgate.core.error.MintError;
import sh.mintgate.core.error.OracleException;
import sh.mintgate.core.event.AssetUpdated;
import sh.mintgate.core.event.RecordingEventSink;
import sh.mintgate.core.event.RequiredBalanceUpdated;
import sh.mintgate.core.types.Address;

@ExtendWith(MockitoExtension.class)
class EligibilityGateTest {

    @Mock
    private BalanceOracle oracle;

    private RecordingEventSink events;
    private EligibilityGate gate;

    @BeforeEach
    void setUp() {
        events = new RecordingEventSink();
        AuthorizationRegistry authorization = new AuthorizationRegistry(OWNER, events);
        gate = new EligibilityGate(oracle, authorization, events, ASSET, THRESHOLD);
    }

    @Test
    void balanceEqualToThresholdQualifies() {
        when(oracle.balanceOf(ASSET, ALICE)).thenReturn(units(1010));
        when(oracle.balanceOf(ASSET, BOB)).thenReturn(units(1009));

        assertTrue(gate.hasSufficientBalance(ALICE));
        assertFalse(gate.hasSufficientBalance(BOB));
    }

    @Test
    void oracleFailureSurfacesAsOracleException() {
        IllegalStateException cause = new IllegalStateException("node unreachable");
        when(oracle.balanceOf(ASSET, ALICE)).thenThrow(cause);

        OracleException ex = assertThrows(OracleException.class, () -> gate.hasSufficientBalance(ALICE));
        assertSame(cause, ex.getCause());
        assertEquals(ASSET, ex.asset());
        assertEquals(ALICE, ex.holder());
    }

    @Test
    void negativeOracleBalanceIsAnOracleFailure() {
        when(oracle.balanceOf(ASSET, ALICE)).thenReturn(BigInteger.valueOf(-1));

        assertThrows(OracleException.class, () -> gate.describeBalance(ALICE));
    }

    @Test
    void thresholdUpdateAppliesToLaterChecks() {
        when(oracle.balanceOf(ASSET, BOB)).thenReturn(units(500));
        assertFalse(gate.hasSufficientBalance(BOB));

        assertTrue(gate.updateThreshold(OWNER, units(500)).isSuccess());

        assertTrue(gate.hasSufficientBalance(BOB));
        assertEquals(List.of(new RequiredBalanceUpdated(THRESHOLD, units(500))), events.events());
    }

    @Test
    void negativeThresholdIsAProgrammingError() {
        assertThrows(IllegalArgumentException.class, () -> gate.updateThreshold(OWNER, units(-1)));
        assertThrows(IllegalArgumentException.class,
                () -> new EligibilityGate(oracle, new AuthorizationRegistry(OWNER, events), events, ASSET, units(-5)));
        assertEquals(THRESHOLD, gate.requiredBalance());
    }

    @Test
    void nonOwnerWithNegativeThresholdIsRefusedNotThrown() {
        assertEquals(MintError.UNAUTHORIZED, gate.updateThreshold(STRANGER, units(-1)).error().orElseThrow());
        assertEquals(THRESHOLD, gate.requiredBalance());
        assertEquals(0, events.size());
    }

    @Test
    void onlyOwnerUpdatesConfiguration() {
        assertEquals(MintError.UNAUTHORIZED, gate.updateThreshold(STRANGER, units(1)).error().orElseThrow());
        assertEquals(MintError.UNAUTHORIZED, gate.updateAsset(STRANGER, ALICE).error().orElseThrow());
        assertEquals(0, events.size());
        verifyNoInteractions(oracle);
    }

    @Test
    void updateAssetSwitchesTheQueriedAsset() {
        Address other = addr(0x0e2c20);
        when(oracle.balanceOf(other, ALICE)).thenReturn(units(2000));

        assertEquals(new AssetUpdated(ASSET, other), gate.updateAsset(OWNER, other).orThrow());
        assertTrue(gate.hasSufficientBalance(ALICE));
    }

    @Test
    void updateAssetRefusesNullIdentity() {
        assertEquals(MintError.INVALID_ADDRESS, gate.updateAsset(OWNER, Address.ZERO).error().orElseThrow());
        assertEquals(ASSET, gate.asset());
    }
}
