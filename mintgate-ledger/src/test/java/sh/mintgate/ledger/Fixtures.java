// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import java.math.BigInteger;

import sh.mintgate.core.types.Address;

final class Fixtures {

    static final Address OWNER = addr(0x0001);
    static final Address ADMIN = addr(0x00ad);
    static final Address ALICE = addr(0xa11c);
    static final Address BOB = addr(0x0b0b);
    static final Address CAROL = addr(0xca01);
    static final Address STRANGER = addr(0x5157);
    static final Address ASSET = addr(0xa55e7);

    static final BigInteger THRESHOLD = BigInteger.valueOf(1010);

    private Fixtures() {
    }

    static Address addr(long n) {
        return Address.of(String.format("0x%040x", n));
    }

    static BigInteger units(long n) {
        return BigInteger.valueOf(n);
    }
}
