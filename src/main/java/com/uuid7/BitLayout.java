package com.uuid7;

import java.time.Instant;

/**
 * BitLayout - pure pack/unpack between the UUIDv7 fields and the 128-bit value
 *
 * <p>Field layout, most significant bit first:</p>
 * <pre>
 *  0                   1                   2                   3
 *  0 1 2 3 4 5 6 7 8 9 0 1 2 3 4 5 6 7 8 9 0 1 2 3 4 5 6 7 8 9 0 1
 * +-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+
 * |                           unix_ts_ms                          |
 * +-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+
 * |          unix_ts_ms           |  ver  |       rand_a          |
 * +-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+
 * |var|                        rand_b                             |
 * +-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+
 * |                            rand_b                             |
 * +-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+-+
 * </pre>
 *
 * <p>The 20-bit sub-millisecond field occupies all 12 bits of rand_a and the
 * top 8 bits of rand_b. The remaining 54 bits of rand_b are random.</p>
 */
public final class BitLayout {

    /** Version nibble in place within the most significant long */
    private static final long VERSION_BITS = (long) DefaultValue.VERSION << 12;

    /** Variant bits in place within the least significant long */
    private static final long VARIANT_BITS = (long) DefaultValue.VARIANT << 62;

    private static final long RAND_A_MASK = (1L << DefaultValue.RAND_A_BITS) - 1;

    private static final long RAND_B_MASK = (1L << DefaultValue.RAND_B_BITS) - 1;

    private static final long RANDOM_MASK = (1L << DefaultValue.RANDOM_BITS) - 1;

    private static final long SUB_MS_LOW_MASK = (1L << DefaultValue.SUB_MS_LOW_BITS) - 1;

    private BitLayout() {
    }

    /**
     * Packs the variable fields into a version 7 identifier.
     *
     * <p>Version and variant are always forced; any bits of the arguments
     * beyond their field widths are discarded.</p>
     *
     * @param unixTsMs milliseconds since the Unix epoch (48 bits)
     * @param randA    12-bit rand_a
     * @param randB    62-bit rand_b
     * @return the packed identifier
     */
    public static Uuid7 pack(long unixTsMs, long randA, long randB) {
        long msb = ((unixTsMs & DefaultValue.MAX_TIMESTAMP_MS) << 16) | VERSION_BITS | (randA & RAND_A_MASK);
        long lsb = VARIANT_BITS | (randB & RAND_B_MASK);
        return new Uuid7(msb, lsb);
    }

    /**
     * Packs a millisecond timestamp, a 20-bit sub-millisecond value and random bits.
     *
     * @param unixTsMs milliseconds since the Unix epoch
     * @param subMs    sub-millisecond field (20 bits)
     * @param random   random bits; only the low 54 are used
     * @return the packed identifier
     */
    public static Uuid7 packSubMs(long unixTsMs, long subMs, long random) {
        long randA = subMs >>> DefaultValue.SUB_MS_LOW_BITS;
        long randB = ((subMs & SUB_MS_LOW_MASK) << DefaultValue.RANDOM_BITS) | (random & RANDOM_MASK);
        return pack(unixTsMs, randA, randB);
    }

    /**
     * Splits an identifier into its five fields. No validation is performed.
     *
     * @param id identifier to split
     * @return the fields
     */
    public static Fields unpack(Uuid7 id) {
        long msb = id.getMostSignificantBits();
        long lsb = id.getLeastSignificantBits();
        return new Fields(id,
                msb >>> 16,
                (int) ((msb >>> 12) & 0xF),
                msb & RAND_A_MASK,
                (int) (lsb >>> 62),
                lsb & RAND_B_MASK);
    }

    /**
     * Returns the 20-bit sub-millisecond field of an identifier.
     */
    public static long subMs(Uuid7 id) {
        long randA = id.getMostSignificantBits() & RAND_A_MASK;
        long randBTop = (id.getLeastSignificantBits() >>> DefaultValue.RANDOM_BITS) & SUB_MS_LOW_MASK;
        return (randA << DefaultValue.SUB_MS_LOW_BITS) | randBTop;
    }

    /**
     * Converts the nanosecond remainder of a millisecond into the 20-bit
     * sub-millisecond field, rounding down.
     *
     * @param remainderNs value in [0, 1_000_000)
     * @return value in [0, 2^20)
     */
    public static long toSubMs(long remainderNs) {
        return (remainderNs << DefaultValue.SUB_MS_BITS) / DefaultValue.NANOS_PER_MILLI;
    }

    /**
     * Converts the 20-bit sub-millisecond field back into nanoseconds, rounding down.
     *
     * @param subMs value in [0, 2^20)
     * @return value in [0, 1_000_000)
     */
    public static long toNanos(long subMs) {
        return (subMs * DefaultValue.NANOS_PER_MILLI) >>> DefaultValue.SUB_MS_BITS;
    }

    /**
     * UUIDv7 field container.
     *
     * <p>Provides structured access to the raw fields and a report for
     * analysis and debugging.</p>
     */
    public static final class Fields {
        /** The identifier the fields were taken from */
        public final Uuid7 id;

        /** Milliseconds since the Unix epoch */
        public final long unixTsMs;

        /** Version nibble */
        public final int version;

        /** 12-bit rand_a */
        public final long randA;

        /** 2-bit variant */
        public final int variant;

        /** 62-bit rand_b */
        public final long randB;

        Fields(Uuid7 id, long unixTsMs, int version, long randA, int variant, long randB) {
            this.id = id;
            this.unixTsMs = unixTsMs;
            this.version = version;
            this.randA = randA;
            this.variant = variant;
            this.randB = randB;
        }

        /**
         * Returns the sub-millisecond field carried in rand_a and the top of rand_b.
         */
        public long subMs() {
            return (randA << DefaultValue.SUB_MS_LOW_BITS) | (randB >>> DefaultValue.RANDOM_BITS);
        }

        /**
         * Generates a detailed report of the identifier's fields.
         *
         * @return formatted report string
         */
        public String generateReport() {
            return String.format(
                    "═══════════════════════════════════════\n" +
                            "UUIDv7 Detailed Report\n" +
                            "═══════════════════════════════════════\n" +
                            "UUID            : %s\n" +
                            "id25            : %s\n" +
                            "unix_ts_ms      : %d (%s)\n" +
                            "Version         : %d\n" +
                            "rand_a          : 0x%03X\n" +
                            "Variant         : %d\n" +
                            "rand_b          : 0x%016X\n" +
                            "Sub-ms field    : %d\n" +
                            "═══════════════════════════════════════\n",
                    id, Id25Codec.encode(id, Id25Codec.Alphabet.LOWER),
                    unixTsMs, Instant.ofEpochMilli(unixTsMs),
                    version, randA, variant, randB, subMs());
        }

        @Override
        public String toString() {
            return String.format("UUID[%s] ms:%d ver:%d rand_a:0x%03X var:%d rand_b:0x%016X",
                    id, unixTsMs, version, randA, variant, randB);
        }
    }
}
