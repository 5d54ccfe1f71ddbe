package com.uuid7;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.LongAdder;


/**
 * Uuid7Generator - time-ordered UUID version 7 generator
 *
 * <p>Each identifier carries the millisecond timestamp in its top 48 bits and a
 * 20-bit sub-millisecond field in rand_a plus the top 8 bits of rand_b, leaving
 * 54 bits of cryptographic randomness. When two calls land on the same
 * sub-millisecond slot the field is bumped by one, so identifiers from the
 * same generator sort strictly increasing even when the clock is coarser than
 * the call rate.</p>
 *
 * <p><b>Channels:</b>
 * <ul>
 *   <li>"now" calls ({@link #next()}) read the injected clock while holding the
 *   channel lock. If the clock steps backwards the channel holds at its last
 *   timestamp, so output never regresses.</li>
 *   <li>"as-of" calls ({@link #next(long)}) encode the caller's timestamp as
 *   given, bumping the counter only for an exact repeat of the previous slot,
 *   which allows backfilling historical records without disturbing the live
 *   sequence.</li>
 * </ul>
 * The two channels keep separate state under separate locks.</p>
 *
 * <p><b>Sentinels:</b> an as-of timestamp of {@code 0} yields {@link Uuid7#NIL}
 * and {@code -1} yields {@link Uuid7#MAX}; neither touches monotonic state.</p>
 *
 * <p>Instances are thread-safe. {@link #getDefault()} returns a process-wide
 * instance, created on first use with the system clock and the random source
 * chosen by {@link SecureRandomAllocator}, that lives until the class is
 * unloaded.</p>
 */
public final class Uuid7Generator {

    private final EpochNanoClock clock;

    private final RandomSource randomSource;

    /** State for calls that read the clock */
    private final MonotonicState nowState = new MonotonicState("now", true);

    /** State for calls with a caller-supplied timestamp */
    private final MonotonicState asOfState = new MonotonicState("as-of", false);

    // ==================== Monitoring Fields ====================

    /** Thread-safe counter for total generated IDs, sentinels excluded */
    private final LongAdder totalGenerated = new LongAdder();

    private static final class DefaultHolder {
        static final Uuid7Generator INSTANCE = new Uuid7Generator();
    }

    /**
     * Creates a generator on the system clock and the configured SecureRandom.
     */
    public Uuid7Generator() {
        this(EpochNanoClock.SYSTEM, SecureRandomAllocator.getRandomSource());
    }

    /**
     * Creates a generator on the given providers.
     *
     * @param clock        nanoseconds since the Unix epoch
     * @param randomSource cryptographically secure random bytes
     */
    public Uuid7Generator(EpochNanoClock clock, RandomSource randomSource) {
        if (clock == null) throw new IllegalArgumentException("clock must not be null");
        if (randomSource == null) throw new IllegalArgumentException("randomSource must not be null");
        this.clock = clock;
        this.randomSource = randomSource;
    }

    /**
     * Returns the process-wide generator.
     */
    public static Uuid7Generator getDefault() {
        return DefaultHolder.INSTANCE;
    }

    // ==================== Core Generation Methods ====================

    /**
     * Generates an identifier for the current time.
     *
     * @return an identifier greater than every earlier one from {@code next()} on this generator,
     *         unless 2^20 identifiers were already taken in the same millisecond
     * @throws InvalidTimestampException if the clock returns a timestamp that does not fit
     */
    public Uuid7 next() {
        // Randomness first: a failing source must leave the state untouched
        long random = randomBits();
        return emit(nowState.advance(clock), random);
    }

    /**
     * Generates an identifier as of an explicit timestamp.
     *
     * <p>A non-negative {@code long} of nanoseconds tops out near year 2262, well
     * inside the 48-bit millisecond field, so no upper bound check is needed.</p>
     *
     * @param timestampNs nanoseconds since the Unix epoch, {@code 0} for nil or {@code -1} for max
     * @return the identifier
     * @throws InvalidTimestampException if the timestamp is negative and not {@code -1}
     */
    public Uuid7 next(long timestampNs) {
        if (timestampNs == DefaultValue.NIL_TIMESTAMP_NS) {
            return Uuid7.NIL;
        }
        if (timestampNs == DefaultValue.MAX_TIMESTAMP_NS) {
            return Uuid7.MAX;
        }
        if (timestampNs < 0) {
            throw new InvalidTimestampException("Timestamp must be non-negative (or -1 for max): " + timestampNs);
        }
        long random = randomBits();
        MonotonicState.Slot slot = asOfState.advance(timestampNs / DefaultValue.NANOS_PER_MILLI,
                BitLayout.toSubMs(timestampNs % DefaultValue.NANOS_PER_MILLI));
        return emit(slot, random);
    }

    /**
     * Generates an identifier as of an instant. {@link Instant#EPOCH} yields nil.
     *
     * @throws InvalidTimestampException if the instant is before the epoch or
     *         does not fit in a signed 64-bit nanosecond count
     */
    public Uuid7 next(Instant instant) {
        if (instant.isBefore(Instant.EPOCH)) {
            throw new InvalidTimestampException("Instant before the Unix epoch: " + instant);
        }
        long timestampNs;
        try {
            timestampNs = Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L),
                    instant.getNano());
        } catch (ArithmeticException e) {
            throw new InvalidTimestampException("Instant out of range: " + instant, e);
        }
        return next(timestampNs);
    }

    private Uuid7 emit(MonotonicState.Slot slot, long random) {
        totalGenerated.increment();
        return BitLayout.packSubMs(slot.ms, slot.subMs, random);
    }

    private long randomBits() {
        byte[] bytes = randomSource.randomBytes(DefaultValue.RANDOM_BYTES);
        if (bytes == null || bytes.length < DefaultValue.RANDOM_BYTES) {
            throw new IllegalStateException("Random source returned "
                    + (bytes == null ? "null" : bytes.length + " bytes")
                    + ", expected " + DefaultValue.RANDOM_BYTES);
        }
        long value = 0;
        for (int i = 0; i < DefaultValue.RANDOM_BYTES; i++) {
            value = (value << 8) | (bytes[i] & 0xFF);
        }
        return value;
    }

    // ==================== Output Forms ====================

    /**
     * Generates an identifier for the current time as a {@link UUID}.
     */
    public UUID nextUuid() {
        return next().toUuid();
    }

    /**
     * Generates an identifier for the current time in canonical dashed form.
     */
    public String nextString() {
        return next().toString();
    }

    /**
     * Generates an identifier for the current time as 32 lowercase hex digits.
     */
    public String nextHex() {
        return next().toHex();
    }

    /**
     * Generates an identifier for the current time as 16 big-endian bytes.
     */
    public byte[] nextBytes() {
        return next().toBytes();
    }

    /**
     * Generates an identifier for the current time as an unsigned integer.
     */
    public BigInteger nextBigInteger() {
        return next().toBigInteger();
    }

    /**
     * Generates an identifier for the current time in lowercase id25 form.
     */
    public String nextId25() {
        return next().toId25(Id25Codec.Alphabet.LOWER);
    }

    /**
     * Generates an identifier for the current time in id25 form.
     */
    public String nextId25(Id25Codec.Alphabet alphabet) {
        return next().toId25(alphabet);
    }

    // ==================== Monitoring ====================

    /**
     * Returns the number of non-sentinel identifiers generated so far.
     */
    public long getTotalGenerated() {
        return totalGenerated.sum();
    }

    public EpochNanoClock getClock() {
        return clock;
    }

    public RandomSource getRandomSource() {
        return randomSource;
    }

    MonotonicState nowState() {
        return nowState;
    }

    MonotonicState asOfState() {
        return asOfState;
    }

    /**
     * Returns configuration and state information as formatted string.
     *
     * @return formatted configuration report
     */
    public String getInfo() {
        MonotonicState.Slot now = nowState.last();
        MonotonicState.Slot asOf = asOfState.last();
        long rangeYears = DefaultValue.MAX_TIMESTAMP_MS / (365L * 24 * 3600 * 1000);
        double resolutionNs = (double) DefaultValue.NANOS_PER_MILLI / (1L << DefaultValue.SUB_MS_BITS);

        return String.format(
                "═══════════════════════════════════════\n" +
                        "Uuid7Generator Config\n" +
                        "Layout          : %s\n" +
                        "Timestamp Range : %,d ms = ~%d years from 1970\n" +
                        "Resolution      : %.3f ns (%,d slots/ms)\n" +
                        "Clock           : %s\n" +
                        "Random Source   : %s\n" +
                        "Last now slot   : %d ms / %d\n" +
                        "Last as-of slot : %d ms / %d\n" +
                        "Total Generated : %,d\n" +
                        "═══════════════════════════════════════\n",
                DefaultValue.getDefaultConfigSummary(),
                DefaultValue.MAX_TIMESTAMP_MS, rangeYears,
                resolutionNs, DefaultValue.MAX_SUB_MS + 1,
                clock, randomSource,
                now.ms, now.subMs,
                asOf.ms, asOf.subMs,
                getTotalGenerated()
        );
    }
}
