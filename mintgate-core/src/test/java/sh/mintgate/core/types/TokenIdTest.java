// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.types;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

class TokenIdTest {

    @Test
    void of_createsFromLong() {
        assertEquals(BigInteger.valueOf(42), TokenId.of(42).value());
    }

    @Test
    void zeroIsValid() {
        assertEquals(TokenId.ZERO, TokenId.of(0));
    }

    @Test
    void constructor_rejectsNull() {
        assertThrows(NullPointerException.class, () -> new TokenId(null));
    }

    @Test
    void constructor_rejectsNegative() {
        assertThrows(IllegalArgumentException.class, () -> TokenId.of(-1));
    }

    @Test
    void decimalRenderingHandlesValuesBeyondLong() {
        BigInteger max = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);
        assertEquals(max.toString(), new TokenId(max).toDecimalString());
        assertEquals("255", TokenId.of(0xff).toDecimalString());
    }

    @Test
    void toString_includesValue() {
        assertEquals("TokenId(7)", TokenId.of(7).toString());
    }
}
