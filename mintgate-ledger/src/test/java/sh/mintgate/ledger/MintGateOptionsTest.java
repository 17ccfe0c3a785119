// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import static org.junit.jupiter.api.Assertions.*;
import static sh.mintgate.ledger.Fixtures.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import sh.mintgate.core.types.TokenId;

class MintGateOptionsTest {

    @Test
    void defaultsMatchTheReferenceDeployment() {
        MintGateOptions defaults = MintGateOptions.defaults();

        assertEquals(new BigInteger("10100000"), defaults.requiredBalance());
        assertEquals(TokenId.ZERO, defaults.mintableTokenId());
        assertEquals(BigInteger.ONE, defaults.mintQuantity());
        assertNull(defaults.asset());
        assertEquals(MintGateOptions.DEFAULT_NAME, defaults.name());
    }

    @Test
    void builderValidatesValues() {
        MintGateOptions.Builder builder = MintGateOptions.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.requiredBalance(BigInteger.valueOf(-1)));
        assertThrows(IllegalArgumentException.class, () -> builder.mintQuantity(BigInteger.ZERO));
        assertThrows(IllegalArgumentException.class, () -> builder.name(" "));
        assertThrows(IllegalArgumentException.class, () -> builder.symbol(""));
        assertThrows(NullPointerException.class, () -> builder.mintableTokenId(null));
    }

    @Test
    void zeroThresholdIsAllowed() {
        assertEquals(BigInteger.ZERO, MintGateOptions.builder().requiredBalance(BigInteger.ZERO).build().requiredBalance());
    }

    @Test
    void toBuilderCopiesEveryField() {
        MintGateOptions options = MintGateOptions.builder()
                .name("Pass")
                .symbol("P")
                .asset(ASSET)
                .requiredBalance(THRESHOLD)
                .mintableTokenId(TokenId.of(4))
                .mintQuantity(units(2))
                .build();

        assertEquals(options, options.toBuilder().build());
        assertEquals(options.hashCode(), options.toBuilder().build().hashCode());
        assertNotEquals(options, options.toBuilder().mintQuantity(units(3)).build());
    }
}
