// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.types;

import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import sh.mintgate.primitives.Hex;

/**
 * Hex-encoded 20-byte account identity.
 * <p>
 * Every actor the ledger knows about (owner, admins, minters, assets) is an
 * {@code Address}. {@link #ZERO} is the null identity and is rejected wherever an
 * operation needs a real actor.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase, so mixed-case input compares equal.
 *
 * @since 0.1.0
 */
public record Address(@JsonValue String value) {
    private static final int BYTE_LENGTH = 20;

    /**
     * The null identity ({@code 0x0000000000000000000000000000000000000000}).
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!Hex.isFixedLength(value, BYTE_LENGTH)) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Address of(final String value) {
        return new Address(value);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address(Hex.encode(bytes));
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    /**
     * Returns {@code true} if this is the null identity.
     */
    public boolean isZero() {
        return this.equals(ZERO);
    }

    @Override
    public String toString() {
        return value;
    }
}
