// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.examples;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import sh.mintgate.core.MintGateDebug;
import sh.mintgate.core.error.Outcome;
import sh.mintgate.core.event.LoggingEventSink;
import sh.mintgate.core.event.RecordingEventSink;
import sh.mintgate.core.event.TokenMinted;
import sh.mintgate.core.metadata.TokenMetadata;
import sh.mintgate.core.types.Address;
import sh.mintgate.core.types.TokenId;
import sh.mintgate.ledger.BatchMintResult;
import sh.mintgate.ledger.MintGate;
import sh.mintgate.ledger.MintGateOptions;
import sh.mintgate.ledger.memory.InMemoryBalanceOracle;
import sh.mintgate.ledger.memory.InMemoryIssuance;

/**
 * Walks through self-service and batch issuance against in-memory collaborators.
 *
 * <p>Usage:
 * <pre>
 * mvn -pl mintgate-examples -am -q exec:java \
 *   -Dexec.mainClass=sh.mintgate.examples.SelfMintExample \
 *   -Dmintgate.examples.mode=self
 * </pre>
 *
 * <p>Modes: {@code self} (threshold check, one-time mint and reading the metadata
 * document behind the resolved URI), {@code batch} (owner batch with skips). Set {@code -Dmintgate.examples.debug=true} for ledger debug logs.
 */
public final class SelfMintExample {

    private static final Address OWNER = Address.of("0x1111111111111111111111111111111111111111");
    private static final Address ASSET = Address.of("0x2222222222222222222222222222222222222222");
    private static final Address ALICE = Address.of("0x00000000000000000000000000000000000a11ce");
    private static final Address BOB = Address.of("0x0000000000000000000000000000000000000b0b");
    private static final Address CAROL = Address.of("0x00000000000000000000000000000000000ca401");

    private SelfMintExample() {
    }

    public static void main(String[] args) {
        MintGateDebug.setEnabled(Boolean.getBoolean("mintgate.examples.debug"));

        final String mode = System.getProperty("mintgate.examples.mode", "self");
        switch (mode) {
            case "self" -> runSelfMintDemo();
            case "batch" -> runBatchDemo();
            default -> {
                System.out.println("Unknown mode: " + mode);
                System.out.println("Use -Dmintgate.examples.mode=self or batch");
            }
        }
    }

    private static void runSelfMintDemo() {
        System.out.println("=== Self-service mint ===");
        InMemoryBalanceOracle oracle = new InMemoryBalanceOracle();
        RecordingEventSink recorded = new RecordingEventSink();
        MintGate gate = newGate(oracle, recorded);
        BigInteger required = gate.requiredBalance();

        oracle.setBalance(ASSET, ALICE, required);
        oracle.setBalance(ASSET, BOB, required.subtract(BigInteger.ONE));

        report("alice", gate.selfMint(ALICE));
        report("bob", gate.selfMint(BOB));
        report("alice again", gate.selfMint(ALICE));

        gate.setURI(OWNER, TokenId.ZERO, "ipfs://members-pass/").orThrow();
        String uri = gate.resolveURI(TokenId.ZERO).orThrow();
        System.out.println("token 0 uri  = " + uri);

        Map<String, String> published = new HashMap<>();
        published.put(uri, new TokenMetadata(
                "Members Pass", "Held by accounts above the asset threshold",
                "ipfs://members-pass/0.png", 0, Map.of("tier", "founding")).toJson());
        TokenMetadata metadata = TokenMetadata.fromJson(published.get(uri));
        System.out.println("token 0 name = " + metadata.name() + " " + metadata.properties());
        System.out.println("total issued = " + gate.totalIssued());
        System.out.println("events seen  = " + recorded.size());
    }

    private static void runBatchDemo() {
        System.out.println("=== Owner batch mint ===");
        InMemoryBalanceOracle oracle = new InMemoryBalanceOracle();
        MintGate gate = newGate(oracle, new RecordingEventSink());

        oracle.setBalance(ASSET, ALICE, gate.requiredBalance());
        gate.selfMint(ALICE).orThrow();

        BatchMintResult result = gate.batchMint(OWNER, List.of(ALICE, BOB, CAROL, BOB)).orThrow();
        for (BatchMintResult.Entry entry : result.entries()) {
            System.out.println(entry.recipient() + " -> " + entry.status());
        }
        System.out.println("issued by batch = " + result.issuedQuantity());
        System.out.println("total issued    = " + gate.totalIssued());

        Outcome<BatchMintResult> byStranger = gate.batchMint(BOB, List.of(CAROL));
        System.out.println("batch by non-owner: " + byStranger.error().orElseThrow());
    }

    private static MintGate newGate(InMemoryBalanceOracle oracle, RecordingEventSink recorded) {
        return MintGate.builder()
                .owner(OWNER)
                .oracle(oracle)
                .issuance(new InMemoryIssuance())
                .events(recorded.andThen(new LoggingEventSink()))
                .options(MintGateOptions.builder().asset(ASSET).build())
                .build();
    }

    private static void report(String who, Outcome<TokenMinted> outcome) {
        if (outcome instanceof Outcome.Success<TokenMinted> success) {
            System.out.println(who + ": minted " + success.value().quantity()
                    + " of token " + success.value().tokenId().toDecimalString());
        } else if (outcome instanceof Outcome.Rejected<TokenMinted> rejected) {
            System.out.println(who + ": refused " + rejected.reason() + " (" + rejected.detail() + ")");
        }
    }
}
