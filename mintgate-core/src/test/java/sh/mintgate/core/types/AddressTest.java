// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.types;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

class AddressTest {

    private static final String CHECKSUMMED = "0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed";

    @Test
    void normalizesToLowercase() {
        Address address = new Address(CHECKSUMMED);
        assertEquals(CHECKSUMMED.toLowerCase(), address.value());
        assertEquals(new Address(CHECKSUMMED.toLowerCase()), address);
    }

    @Test
    void rejectsMalformedValues() {
        assertThrows(NullPointerException.class, () -> new Address(null));
        assertThrows(IllegalArgumentException.class, () -> new Address("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> new Address("1".repeat(40)));
        assertThrows(IllegalArgumentException.class, () -> new Address("0x" + "g".repeat(40)));
    }

    @Test
    void zeroIsTheNullIdentity() {
        assertTrue(Address.ZERO.isZero());
        assertTrue(new Address("0x" + "0".repeat(40)).isZero());
        assertFalse(new Address("0x" + "0".repeat(39) + "1").isZero());
    }

    @Test
    void bytesRoundTrip() {
        byte[] raw = new byte[20];
        raw[19] = 0x2a;
        Address address = Address.fromBytes(raw);
        assertEquals("0x" + "0".repeat(38) + "2a", address.value());
        assertArrayEquals(raw, address.toBytes());
        assertThrows(IllegalArgumentException.class, () -> Address.fromBytes(new byte[19]));
    }

    @Test
    void serializesAsBareJsonString() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        Address address = new Address(CHECKSUMMED);
        String json = mapper.writeValueAsString(address);
        assertEquals("\"" + CHECKSUMMED.toLowerCase() + "\"", json);
        assertEquals(address, mapper.readValue(json, Address.class));
    }
}
