// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.primitives;

import java.util.Arrays;

/**
 * Hex encoding and decoding with optional {@code 0x} prefixes.
 *
 * <p>Used to validate and normalise identity addresses. Output is always lowercase.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLE_LOOKUP = new int[128];

    /** Encoded form of an empty payload. */
    public static final String EMPTY = "0x";

    static {
        Arrays.fill(NIBBLE_LOOKUP, -1);
        for (int i = 0; i <= 9; i++) {
            NIBBLE_LOOKUP['0' + i] = i;
        }
        for (int i = 0; i < 6; i++) {
            NIBBLE_LOOKUP['a' + i] = 10 + i;
            NIBBLE_LOOKUP['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Decodes a hex string, with or without a {@code 0x} prefix.
     *
     * @param hexString the string to decode
     * @return the decoded bytes
     * @throws IllegalArgumentException if the input is null, has an odd number of
     *                                  digits, or contains a non-hex character
     */
    public static byte[] decode(final String hexString) {
        if (hexString == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        final int start = hasPrefix(hexString) ? 2 : 0;
        final int digits = hexString.length() - start;
        if ((digits & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hexString);
        }

        final byte[] out = new byte[digits / 2];
        for (int i = 0; i < out.length; i++) {
            final int high = nibble(hexString.charAt(start + 2 * i), hexString);
            final int low = nibble(hexString.charAt(start + 2 * i + 1), hexString);
            out[i] = (byte) ((high << 4) | low);
        }
        return out;
    }

    /**
     * Encodes bytes as a lowercase {@code 0x}-prefixed string.
     *
     * @param bytes the bytes to encode
     * @return the encoded string; {@link #EMPTY} for an empty array
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encode(final byte[] bytes) {
        return EMPTY + encodeNoPrefix(bytes);
    }

    /**
     * Encodes bytes as lowercase hex without a prefix.
     *
     * @param bytes the bytes to encode
     * @return the encoded digits
     * @throws IllegalArgumentException if {@code bytes} is null
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        final char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            final int v = bytes[i] & 0xFF;
            chars[2 * i] = HEX_CHARS[v >>> 4];
            chars[2 * i + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }

    /**
     * Returns {@code true} if the string starts with {@code 0x} (case-insensitive).
     *
     * @param hexString the string to check, may be null
     * @return whether the prefix is present
     */
    public static boolean hasPrefix(final String hexString) {
        return hexString != null
                && hexString.length() >= 2
                && hexString.charAt(0) == '0'
                && (hexString.charAt(1) == 'x' || hexString.charAt(1) == 'X');
    }

    /**
     * Returns {@code true} if the string is {@code 0x} followed by exactly
     * {@code byteLength * 2} hex digits.
     *
     * @param hexString  the candidate
     * @param byteLength the expected decoded length
     * @return whether the string has that exact shape
     */
    public static boolean isFixedLength(final String hexString, final int byteLength) {
        if (!hasPrefix(hexString) || hexString.length() != 2 + byteLength * 2) {
            return false;
        }
        for (int i = 2; i < hexString.length(); i++) {
            final char c = hexString.charAt(i);
            if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
                return false;
            }
        }
        return true;
    }

    private static int nibble(final char c, final String originalInput) {
        if (c >= NIBBLE_LOOKUP.length || NIBBLE_LOOKUP[c] == -1) {
            throw new IllegalArgumentException("invalid hex character in: " + originalInput);
        }
        return NIBBLE_LOOKUP[c];
    }
}
