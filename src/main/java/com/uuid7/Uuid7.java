package com.uuid7;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.UUID;

/**
 * Immutable 128-bit identifier.
 *
 * <p>Instances order by their unsigned 128-bit value, which is also the order
 * of their hex, canonical and id25 strings and of their big-endian bytes.
 * {@link java.util.UUID#compareTo} compares signed halves and therefore does
 * not give that order, so this type is used instead.</p>
 *
 * <p>The value is not required to be version 7: parsing accepts any 128-bit
 * value, and {@link #NIL} and {@link #MAX} are reserved sentinels.</p>
 */
public final class Uuid7 implements Comparable<Uuid7>, Serializable {

    private static final long serialVersionUID = 1L;

    /** All 128 bits zero */
    public static final Uuid7 NIL = new Uuid7(0L, 0L);

    /** All 128 bits one */
    public static final Uuid7 MAX = new Uuid7(-1L, -1L);

    private final long msb;
    private final long lsb;

    public Uuid7(long msb, long lsb) {
        this.msb = msb;
        this.lsb = lsb;
    }

    // ==================== Factories ====================

    /**
     * Parses any text form: canonical (36 chars), hex (32 chars) or id25 (25 chars).
     *
     * @throws MalformedIdentifierException if the text matches none of them
     */
    public static Uuid7 parse(String text) {
        if (text == null) {
            throw new MalformedIdentifierException("identifier string is null");
        }
        switch (text.length()) {
            case DefaultValue.CANONICAL_LENGTH:
                return Uuid7Codec.parseCanonical(text);
            case DefaultValue.HEX_LENGTH:
                return Uuid7Codec.parseHex(text);
            case DefaultValue.ID25_LENGTH:
                return Id25Codec.decode(text);
            default:
                throw new MalformedIdentifierException(
                        "UUIDv7 string '" + text + "' is the wrong length: " + text.length());
        }
    }

    public static Uuid7 fromBytes(byte[] bytes) {
        return Uuid7Codec.fromBytes(bytes);
    }

    public static Uuid7 fromBigInteger(BigInteger value) {
        return Uuid7Codec.fromBigInteger(value);
    }

    public static Uuid7 fromUuid(UUID uuid) {
        return new Uuid7(uuid.getMostSignificantBits(), uuid.getLeastSignificantBits());
    }

    // ==================== Fields ====================

    public long getMostSignificantBits() {
        return msb;
    }

    public long getLeastSignificantBits() {
        return lsb;
    }

    /** Version nibble (bits 48-51). */
    public int version() {
        return (int) ((msb >>> 12) & 0xF);
    }

    /** Variant bits (bits 64-65). */
    public int variant() {
        return (int) (lsb >>> 62);
    }

    public boolean isNil() {
        return msb == 0L && lsb == 0L;
    }

    public boolean isMax() {
        return msb == -1L && lsb == -1L;
    }

    public BitLayout.Fields fields() {
        return BitLayout.unpack(this);
    }

    // ==================== Conversions ====================

    public UUID toUuid() {
        return new UUID(msb, lsb);
    }

    public byte[] toBytes() {
        return Uuid7Codec.toBytes(this);
    }

    public BigInteger toBigInteger() {
        return Uuid7Codec.toBigInteger(this);
    }

    public String toHex() {
        return Uuid7Codec.toHex(this);
    }

    public String toId25() {
        return Id25Codec.encode(this, Id25Codec.Alphabet.LOWER);
    }

    public String toId25(Id25Codec.Alphabet alphabet) {
        return Id25Codec.encode(this, alphabet);
    }

    /**
     * Returns the canonical dashed form, e.g. {@code 017f22e2-79b0-7cc3-98c4-dc0c0c07398f}.
     */
    @Override
    public String toString() {
        return Uuid7Codec.toCanonical(this);
    }

    @Override
    public int compareTo(Uuid7 other) {
        int cmp = Long.compareUnsigned(msb, other.msb);
        return cmp != 0 ? cmp : Long.compareUnsigned(lsb, other.lsb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Uuid7)) return false;
        Uuid7 other = (Uuid7) o;
        return msb == other.msb && lsb == other.lsb;
    }

    @Override
    public int hashCode() {
        long hilo = msb ^ lsb;
        return ((int) (hilo >> 32)) ^ (int) hilo;
    }
}
