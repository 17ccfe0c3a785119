// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HexTest {

    @Test
    @DisplayName("Encoding empty and single bytes")
    void encodeBasic() {
        assertEquals("0x", Hex.encode(new byte[] {}));
        assertEquals("0x00", Hex.encode(new byte[] {0x00}));
        assertEquals("0xff", Hex.encode(new byte[] {(byte) 0xFF}));
    }

    @Test
    void encodeNoPrefixIsLowercase() {
        byte[] bytes = new byte[] {0x01, 0x23, (byte) 0xAB, (byte) 0xCD};
        assertEquals("0123abcd", Hex.encodeNoPrefix(bytes));
    }

    @Test
    void decodeAcceptsEitherPrefixCaseOrNone() {
        byte[] expected = new byte[] {0x0A, (byte) 0xBC, (byte) 0xDE, (byte) 0xF0};
        assertArrayEquals(expected, Hex.decode("0x0AbCdEf0"));
        assertArrayEquals(expected, Hex.decode("0X0aBcDeF0"));
        assertArrayEquals(expected, Hex.decode("0aBcDeF0"));
        assertArrayEquals(new byte[0], Hex.decode("0x"));
    }

    @Test
    void decodeRejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0x1"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode("0xz1"));
        assertThrows(IllegalArgumentException.class, () -> Hex.encode(null));
    }

    @Test
    void hasPrefix() {
        assertTrue(Hex.hasPrefix("0x1"));
        assertTrue(Hex.hasPrefix("0Xff"));
        assertFalse(Hex.hasPrefix("1"));
        assertFalse(Hex.hasPrefix(""));
        assertFalse(Hex.hasPrefix(null));
    }

    @Test
    void isFixedLengthChecksPrefixLengthAndDigits() {
        assertTrue(Hex.isFixedLength("0x" + "aB".repeat(20), 20));
        assertFalse(Hex.isFixedLength("aB".repeat(20), 20));
        assertFalse(Hex.isFixedLength("0x" + "ab".repeat(19), 20));
        assertFalse(Hex.isFixedLength("0x" + "zz".repeat(20), 20));
        assertFalse(Hex.isFixedLength(null, 20));
    }
}
