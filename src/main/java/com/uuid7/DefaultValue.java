package com.uuid7;

/**
 * UUIDv7 Layout Constants and Default Configuration Values
 *
 * <p>Centralized location for the fixed field widths of the version 7 layout,
 * the reserved sentinel timestamps and the configuration keys read by
 * {@link SecureRandomAllocator}. Every component refers to these values instead
 * of repeating the literals.</p>
 */
public final class DefaultValue {

    // ==================== Field Layout ====================

    /** Number of bits for the millisecond timestamp (unix_ts_ms) */
    public static final int TIMESTAMP_BITS = 48;

    /** Number of bits of rand_a (top of the sub-millisecond field) */
    public static final int RAND_A_BITS = 12;

    /** Number of bits of rand_b below the variant */
    public static final int RAND_B_BITS = 62;

    /** Number of bits of the sub-millisecond field spread over rand_a and rand_b */
    public static final int SUB_MS_BITS = 20;

    /** Number of sub-millisecond bits stored at the top of rand_b */
    public static final int SUB_MS_LOW_BITS = SUB_MS_BITS - RAND_A_BITS;

    /** Number of true random bits at the bottom of rand_b */
    public static final int RANDOM_BITS = RAND_B_BITS - SUB_MS_LOW_BITS;

    /** Random bytes fetched per identifier (56 bits, of which {@link #RANDOM_BITS} are kept) */
    public static final int RANDOM_BYTES = 7;

    /** Version nibble */
    public static final int VERSION = 7;

    /** Variant bits (0b10) */
    public static final int VARIANT = 2;

    /** Largest millisecond timestamp that fits the layout */
    public static final long MAX_TIMESTAMP_MS = (1L << TIMESTAMP_BITS) - 1;

    /** Largest sub-millisecond value; the counter saturates here */
    public static final long MAX_SUB_MS = (1L << SUB_MS_BITS) - 1;

    /** Nanoseconds per millisecond */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    // ==================== Sentinels ====================

    /** Timestamp requesting the nil identifier */
    public static final long NIL_TIMESTAMP_NS = 0L;

    /** Timestamp requesting the max identifier */
    public static final long MAX_TIMESTAMP_NS = -1L;

    // ==================== Text Forms ====================

    /** Length of the plain hex form */
    public static final int HEX_LENGTH = 32;

    /** Length of the dashed canonical form */
    public static final int CANONICAL_LENGTH = 36;

    /** Length of the id25 compact form */
    public static final int ID25_LENGTH = 25;

    /** Radix of the id25 compact form */
    public static final int ID25_RADIX = 35;

    /** Byte length of the binary form */
    public static final int BYTE_LENGTH = 16;

    // ==================== Configuration Keys ====================

    /** Environment variable naming the SecureRandom algorithm */
    public static final String RANDOM_ALGORITHM_ENV_KEY = "UUID7_RANDOM_ALGORITHM";

    /** JVM system property naming the SecureRandom algorithm */
    public static final String RANDOM_ALGORITHM_PROP_KEY = "uuid7.random.algorithm";

    // ==================== Utility Methods ====================

    /** Prevent instantiation */
    private DefaultValue() {
        throw new AssertionError("Cannot instantiate DefaultValue class");
    }

    /**
     * Returns default configuration summary
     */
    public static String getDefaultConfigSummary() {
        return String.format(
                "Default Layout: Bits=%d(ts)+4(ver)+%d(rand_a)+2(var)+%d(rand_b), SubMs=%d bits, Random=%d bits",
                TIMESTAMP_BITS, RAND_A_BITS, RAND_B_BITS, SUB_MS_BITS, RANDOM_BITS
        );
    }
}
