// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.examples;

import java.math.BigInteger;

import sh.mintgate.core.MintGateDebug;
import sh.mintgate.core.event.LoggingEventSink;
import sh.mintgate.core.types.Address;
import sh.mintgate.ledger.LedgerSnapshot;
import sh.mintgate.ledger.MintGate;
import sh.mintgate.ledger.MintGateOptions;
import sh.mintgate.ledger.memory.InMemoryBalanceOracle;
import sh.mintgate.ledger.memory.InMemoryIssuance;

/**
 * Creates a gate, verifies its initial state and prints a summary.
 *
 * <p>Usage:
 * <pre>
 * mvn -pl mintgate-examples -am -q exec:java \
 *   -Dmintgate.examples.name="Members Pass" \
 *   -Dmintgate.examples.symbol=PASS \
 *   -Dmintgate.examples.owner=0x1111111111111111111111111111111111111111 \
 *   -Dmintgate.examples.asset=0x2222222222222222222222222222222222222222
 * </pre>
 *
 * <p>Add {@code -Dmintgate.examples.export=true} to print the initial snapshot as JSON.
 */
public final class BootstrapExample {

    private static final String DEFAULT_OWNER = "0x1111111111111111111111111111111111111111";
    private static final String DEFAULT_ASSET = "0x2222222222222222222222222222222222222222";

    private BootstrapExample() {
    }

    public static void main(String[] args) {
        final String name = System.getProperty("mintgate.examples.name", MintGateOptions.DEFAULT_NAME);
        final String symbol = System.getProperty("mintgate.examples.symbol", MintGateOptions.DEFAULT_SYMBOL);
        final Address owner = Address.of(System.getProperty("mintgate.examples.owner", DEFAULT_OWNER));
        final Address asset = Address.of(System.getProperty("mintgate.examples.asset", DEFAULT_ASSET));
        final BigInteger requiredBalance = new BigInteger(System.getProperty(
                "mintgate.examples.requiredBalance", MintGateOptions.DEFAULT_REQUIRED_BALANCE.toString()));
        final boolean export = Boolean.getBoolean("mintgate.examples.export");

        MintGateDebug.setEnabled(Boolean.getBoolean("mintgate.examples.debug"));

        System.out.println("Creating gate...");
        MintGate gate = MintGate.builder()
                .owner(owner)
                .oracle(new InMemoryBalanceOracle())
                .issuance(new InMemoryIssuance())
                .events(new LoggingEventSink())
                .options(MintGateOptions.builder()
                        .name(name)
                        .symbol(symbol)
                        .asset(asset)
                        .requiredBalance(requiredBalance)
                        .build())
                .build();

        System.out.println("Verifying...");
        check(gate.name().equals(name), "name");
        check(gate.symbol().equals(symbol), "symbol");
        check(gate.isOwner(owner), "owner");
        check(gate.adminCount() == 0, "adminCount");
        check(gate.totalIssued().signum() == 0, "totalIssued");

        System.out.println("Summary:");
        System.out.println("  name             = " + gate.name());
        System.out.println("  symbol           = " + gate.symbol());
        System.out.println("  owner            = " + gate.owner());
        System.out.println("  admin count      = " + gate.adminCount());
        System.out.println("  asset            = " + gate.asset());
        System.out.println("  required balance = " + gate.requiredBalance());
        System.out.println("  mintable token   = " + gate.mintableTokenId().toDecimalString());
        System.out.println("  mint quantity    = " + gate.mintQuantity());

        if (export) {
            LedgerSnapshot snapshot = gate.snapshot();
            System.out.println(snapshot.toJson());
        }
    }

    private static void check(boolean condition, String what) {
        if (!condition) {
            throw new IllegalStateException("Verification failed: " + what);
        }
    }
}
