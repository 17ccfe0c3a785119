// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger.memory;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import sh.mintgate.core.types.Address;
import sh.mintgate.core.types.TokenId;

class InMemoryIssuanceTest {

    private static final Address HOLDER = Address.of("0x00000000000000000000000000000000000000aa");
    private static final Address OTHER = Address.of("0x00000000000000000000000000000000000000bb");
    private static final byte[] NO_DATA = new byte[0];

    private final InMemoryIssuance issuance = new InMemoryIssuance();

    @Test
    void issueCreditsHolderAndSupply() {
        issuance.issue(HOLDER, TokenId.ZERO, BigInteger.TWO, NO_DATA);
        issuance.issue(HOLDER, TokenId.ZERO, BigInteger.ONE, NO_DATA);
        issuance.issue(OTHER, TokenId.ZERO, BigInteger.TEN, NO_DATA);

        assertEquals(BigInteger.valueOf(3), issuance.balanceOfToken(HOLDER, TokenId.ZERO));
        assertEquals(BigInteger.valueOf(13), issuance.totalSupply(TokenId.ZERO));
        assertEquals(BigInteger.ZERO, issuance.balanceOfToken(HOLDER, TokenId.of(1)));
    }

    @Test
    void refusesWhatTheCollectionContractWouldRevert() {
        assertThrows(IllegalArgumentException.class,
                () -> issuance.issue(Address.ZERO, TokenId.ZERO, BigInteger.ONE, NO_DATA));
        assertThrows(IllegalArgumentException.class,
                () -> issuance.issue(HOLDER, TokenId.ZERO, BigInteger.ZERO, NO_DATA));
        assertEquals(BigInteger.ZERO, issuance.totalSupply(TokenId.ZERO));
    }
}
