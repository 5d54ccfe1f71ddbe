package com.uuid7;

import java.math.BigInteger;

/**
 * Conversions between {@link Uuid7} and its standard external forms:
 * 16-byte big-endian array, unsigned {@link BigInteger}, 32-character
 * lowercase hex and the dashed 8-4-4-4-12 canonical string.
 *
 * <p>All conversions are total over the 128-bit range, nil and max included.
 * Parsing accepts hex digits of either case and always renders lowercase.</p>
 */
public final class Uuid7Codec {

    /** Zero padding string for hexadecimal conversion */
    private static final String ZEROS_16 = "0000000000000000";

    /** Offsets of the dashes in the canonical form */
    private static final int[] DASH_POSITIONS = {8, 13, 18, 23};

    private static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    private Uuid7Codec() {
    }

    // ==================== Hex ====================

    public static String toHex(Uuid7 id) {
        return paddedHex(id.getMostSignificantBits()) + paddedHex(id.getLeastSignificantBits());
    }

    /**
     * Parses 32 hex digits.
     *
     * @throws MalformedIdentifierException on wrong length or a non-hex character
     */
    public static Uuid7 parseHex(String hex) {
        if (hex == null || hex.length() != DefaultValue.HEX_LENGTH) {
            throw new MalformedIdentifierException("Hex UUID must be " + DefaultValue.HEX_LENGTH
                    + " characters: " + hex);
        }
        return new Uuid7(parseHexLong(hex, 0), parseHexLong(hex, 16));
    }

    // ==================== Canonical ====================

    public static String toCanonical(Uuid7 id) {
        String hex = toHex(id);
        return new StringBuilder(DefaultValue.CANONICAL_LENGTH)
                .append(hex, 0, 8).append('-')
                .append(hex, 8, 12).append('-')
                .append(hex, 12, 16).append('-')
                .append(hex, 16, 20).append('-')
                .append(hex, 20, 32)
                .toString();
    }

    /**
     * Parses the dashed canonical form. Dashes must sit exactly at offsets 8, 13, 18 and 23.
     *
     * @throws MalformedIdentifierException on wrong length, misplaced dash or non-hex character
     */
    public static Uuid7 parseCanonical(String text) {
        if (text == null || text.length() != DefaultValue.CANONICAL_LENGTH) {
            throw new MalformedIdentifierException("Canonical UUID must be " + DefaultValue.CANONICAL_LENGTH
                    + " characters: " + text);
        }
        StringBuilder hex = new StringBuilder(DefaultValue.HEX_LENGTH);
        int dash = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (dash < DASH_POSITIONS.length && i == DASH_POSITIONS[dash]) {
                if (c != '-') {
                    throw new MalformedIdentifierException("Expected '-' at offset " + i + ": " + text);
                }
                dash++;
            } else {
                hex.append(c);
            }
        }
        return parseHex(hex.toString());
    }

    // ==================== Bytes ====================

    public static byte[] toBytes(Uuid7 id) {
        byte[] out = new byte[DefaultValue.BYTE_LENGTH];
        long msb = id.getMostSignificantBits();
        long lsb = id.getLeastSignificantBits();
        for (int i = 0; i < 8; i++) {
            out[i] = (byte) (msb >>> (56 - 8 * i));
            out[8 + i] = (byte) (lsb >>> (56 - 8 * i));
        }
        return out;
    }

    /**
     * Reads 16 big-endian bytes.
     *
     * @throws MalformedIdentifierException if the array is not 16 bytes long
     */
    public static Uuid7 fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != DefaultValue.BYTE_LENGTH) {
            throw new MalformedIdentifierException("UUID byte array must be " + DefaultValue.BYTE_LENGTH
                    + " bytes, got " + (bytes == null ? "null" : String.valueOf(bytes.length)));
        }
        long msb = 0;
        long lsb = 0;
        for (int i = 0; i < 8; i++) {
            msb = (msb << 8) | (bytes[i] & 0xFF);
            lsb = (lsb << 8) | (bytes[8 + i] & 0xFF);
        }
        return new Uuid7(msb, lsb);
    }

    // ==================== Integer ====================

    public static BigInteger toBigInteger(Uuid7 id) {
        return new BigInteger(1, toBytes(id));
    }

    /**
     * Converts an unsigned integer in [0, 2^128).
     *
     * @throws MalformedIdentifierException if the value is negative or wider than 128 bits
     */
    public static Uuid7 fromBigInteger(BigInteger value) {
        if (value == null || value.signum() < 0 || value.compareTo(MAX_VALUE) > 0) {
            throw new MalformedIdentifierException("UUID integer out of 128-bit range: " + value);
        }
        return new Uuid7(value.shiftRight(64).longValue(), value.longValue());
    }

    // ==================== Helpers ====================

    private static String paddedHex(long value) {
        String hex = Long.toHexString(value);
        return paddingZeros(16 - hex.length()) + hex;
    }

    /**
     * Creates a zero-padding string of specified length.
     */
    private static String paddingZeros(int count) {
        return count <= 0 ? "" : ZEROS_16.substring(0, count);
    }

    private static long parseHexLong(String hex, int offset) {
        long value = 0;
        for (int i = offset; i < offset + 16; i++) {
            int digit = hexDigit(hex.charAt(i));
            if (digit < 0) {
                throw new MalformedIdentifierException("Non-hex character '" + hex.charAt(i)
                        + "' in UUID: " + hex);
            }
            value = (value << 4) | digit;
        }
        return value;
    }

    // Character.digit would also accept non-ASCII digits
    private static int hexDigit(char c) {
        if (c >= '0' && c <= '9') return c - '0';
        if (c >= 'a' && c <= 'f') return c - 'a' + 10;
        if (c >= 'A' && c <= 'F') return c - 'A' + 10;
        return -1;
    }
}
