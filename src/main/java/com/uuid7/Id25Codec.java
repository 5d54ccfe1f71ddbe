package com.uuid7;

import java.util.Arrays;

/**
 * id25 - a sortable 25-character rendering of a 128-bit identifier
 *
 * <p>The value is written in base 35, most significant digit first and left
 * padded to 25 symbols, so string order equals numeric order. 25 is the
 * shortest length that covers 128 bits over a single-case alphanumeric
 * alphabet, and dropping one letter still fits: 35^25 &gt; 2^128.</p>
 *
 * <ul>
 *   <li>{@link Alphabet#LOWER} omits {@code 'l'}, which looks like {@code '1'}.</li>
 *   <li>{@link Alphabet#UPPER} omits {@code 'O'}, which looks like {@code '0'}.</li>
 * </ul>
 *
 * <p>Both directions work on four 32-bit limbs rather than {@link java.math.BigInteger}.</p>
 */
public final class Id25Codec {

    private static final long LIMB_MASK = 0xFFFFFFFFL;

    /**
     * The two id25 alphabets. Digits come first in both so that the symbol
     * order matches the digit value order.
     */
    public enum Alphabet {
        LOWER("0123456789abcdefghijkmnopqrstuvwxyz"),
        UPPER("0123456789ABCDEFGHIJKLMNPQRSTUVWXYZ");

        private final char[] symbols;
        private final int[] valueTable = new int[128];

        Alphabet(String symbols) {
            this.symbols = symbols.toCharArray();
            Arrays.fill(valueTable, -1);
            for (int i = 0; i < this.symbols.length; i++) {
                valueTable[this.symbols[i]] = i;
            }
        }

        char symbol(int value) {
            return symbols[value];
        }

        int value(char symbol) {
            return symbol < valueTable.length ? valueTable[symbol] : -1;
        }

        /**
         * Picks the alphabet of an encoded string: lowercase if it holds any
         * lowercase letter, otherwise uppercase. All-digit strings decode the
         * same under either.
         */
        static Alphabet detect(String encoded) {
            for (int i = 0; i < encoded.length(); i++) {
                char c = encoded.charAt(i);
                if (c >= 'a' && c <= 'z') {
                    return LOWER;
                }
            }
            return UPPER;
        }
    }

    private Id25Codec() {
    }

    /**
     * Encodes an identifier with the lowercase alphabet.
     */
    public static String encode(Uuid7 id) {
        return encode(id, Alphabet.LOWER);
    }

    /**
     * Encodes an identifier as 25 base-35 symbols, most significant first.
     */
    public static String encode(Uuid7 id, Alphabet alphabet) {
        long msb = id.getMostSignificantBits();
        long lsb = id.getLeastSignificantBits();
        long[] limbs = {msb >>> 32, msb & LIMB_MASK, lsb >>> 32, lsb & LIMB_MASK};

        char[] out = new char[DefaultValue.ID25_LENGTH];
        for (int pos = out.length - 1; pos >= 0; pos--) {
            long rem = 0;
            for (int j = 0; j < limbs.length; j++) {
                long cur = (rem << 32) | limbs[j];
                limbs[j] = cur / DefaultValue.ID25_RADIX;
                rem = cur % DefaultValue.ID25_RADIX;
            }
            out[pos] = alphabet.symbol((int) rem);
        }
        return new String(out);
    }

    /**
     * Decodes an id25 string, detecting the alphabet from the letter case.
     *
     * @throws MalformedIdentifierException if the length is not 25, a symbol is
     *         outside the detected alphabet, or the value exceeds 128 bits
     */
    public static Uuid7 decode(String encoded) {
        if (encoded == null || encoded.length() != DefaultValue.ID25_LENGTH) {
            throw new MalformedIdentifierException("id25 string must be " + DefaultValue.ID25_LENGTH
                    + " characters: " + encoded);
        }
        return decode(encoded, Alphabet.detect(encoded));
    }

    /**
     * Decodes an id25 string written in the given alphabet.
     *
     * @throws MalformedIdentifierException on bad length, symbol or overflow
     */
    public static Uuid7 decode(String encoded, Alphabet alphabet) {
        if (encoded == null || encoded.length() != DefaultValue.ID25_LENGTH) {
            throw new MalformedIdentifierException("id25 string must be " + DefaultValue.ID25_LENGTH
                    + " characters: " + encoded);
        }
        long[] limbs = new long[4];
        for (int i = 0; i < encoded.length(); i++) {
            char c = encoded.charAt(i);
            int digit = alphabet.value(c);
            if (digit < 0) {
                throw new MalformedIdentifierException("Symbol '" + c + "' is not in the "
                        + alphabet.name().toLowerCase() + " id25 alphabet: " + encoded);
            }
            long carry = digit;
            for (int j = limbs.length - 1; j >= 0; j--) {
                long cur = limbs[j] * DefaultValue.ID25_RADIX + carry;
                limbs[j] = cur & LIMB_MASK;
                carry = cur >>> 32;
            }
            if (carry != 0) {
                throw new MalformedIdentifierException("id25 value exceeds 128 bits: " + encoded);
            }
        }
        return new Uuid7((limbs[0] << 32) | limbs[1], (limbs[2] << 32) | limbs[3]);
    }
}
