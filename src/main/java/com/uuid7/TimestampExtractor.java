package com.uuid7;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Recovers the timestamp embedded in a version 7 identifier.
 *
 * <p>Input may be any representation: canonical or plain hex string (dashes
 * are ignored), id25 string in either case, {@link Uuid7}, {@link UUID},
 * 16 bytes or an unsigned {@link BigInteger}. Identifiers whose version is not
 * 7 have no timestamp; by default that yields an empty result, and a strict
 * extractor throws {@link NotVersion7Exception} instead.</p>
 *
 * <p>Full precision adds the 20-bit sub-millisecond field,
 * {@code floor(subMs * 1_000_000 / 2^20)} nanoseconds, to the millisecond
 * timestamp. {@code msOnly} skips it, for identifiers from generators that
 * filled rand_a with something else.</p>
 *
 * <p>The nil identifier is reported as having no timestamp unless
 * {@link #setNilAsEpoch(boolean)} is on, in which case it maps to zero.</p>
 */
public final class TimestampExtractor {

    /** Whether non-v7 input throws instead of yielding empty */
    private boolean strict = false;

    /** Whether the nil identifier maps to the epoch */
    private boolean nilAsEpoch = false;

    // ==================== Configuration Methods ====================

    /**
     * Sets strict mode.
     *
     * @param strict {@code true} to throw {@link NotVersion7Exception} for non-v7 input
     * @return this extractor for method chaining
     */
    public TimestampExtractor setStrict(boolean strict) {
        this.strict = strict;
        return this;
    }

    /**
     * Sets whether the nil identifier is read as timestamp zero.
     *
     * @param nilAsEpoch {@code true} to map nil to the epoch
     * @return this extractor for method chaining
     */
    public TimestampExtractor setNilAsEpoch(boolean nilAsEpoch) {
        this.nilAsEpoch = nilAsEpoch;
        return this;
    }

    public boolean isStrict() {
        return strict;
    }

    public boolean isNilAsEpoch() {
        return nilAsEpoch;
    }

    // ==================== Normalisation ====================

    /**
     * Parses a string form: 32 hex digits once dashes are removed, or 25 id25 symbols.
     *
     * @throws MalformedIdentifierException for any other length or bad characters
     */
    public static Uuid7 normalize(String text) {
        if (text == null) {
            throw new MalformedIdentifierException("identifier string is null");
        }
        String stripped = text.replace("-", "");
        if (stripped.length() == DefaultValue.HEX_LENGTH) {
            return Uuid7Codec.parseHex(stripped);
        }
        if (text.length() == DefaultValue.ID25_LENGTH) {
            return Id25Codec.decode(text);
        }
        throw new MalformedIdentifierException("UUIDv7 string '" + text + "' is the wrong length");
    }

    // ==================== Nanoseconds ====================

    public OptionalLong extractNanos(String text) {
        return extractNanos(normalize(text), false);
    }

    public OptionalLong extractNanos(String text, boolean msOnly) {
        return extractNanos(normalize(text), msOnly);
    }

    public OptionalLong extractNanos(UUID uuid, boolean msOnly) {
        return extractNanos(Uuid7.fromUuid(uuid), msOnly);
    }

    public OptionalLong extractNanos(byte[] bytes, boolean msOnly) {
        return extractNanos(Uuid7Codec.fromBytes(bytes), msOnly);
    }

    public OptionalLong extractNanos(BigInteger value, boolean msOnly) {
        return extractNanos(Uuid7Codec.fromBigInteger(value), msOnly);
    }

    public OptionalLong extractNanos(Uuid7 id) {
        return extractNanos(id, false);
    }

    /**
     * Returns nanoseconds since the Unix epoch.
     *
     * @param id     identifier to read
     * @param msOnly {@code true} to ignore the sub-millisecond field
     * @return the timestamp, or empty if the identifier is not version 7
     * @throws NotVersion7Exception   in strict mode when the version is not 7
     * @throws InvalidTimestampException if the embedded millisecond is past 2262-04-11, where a signed
     *         64-bit nanosecond count ends; {@link #extractInstant(Uuid7, boolean)} covers the full range
     */
    public OptionalLong extractNanos(Uuid7 id, boolean msOnly) {
        if (!hasTimestamp(id)) {
            return OptionalLong.empty();
        }
        if (id.isNil()) {
            return OptionalLong.of(0L);
        }
        BitLayout.Fields fields = id.fields();
        long fractionNs = msOnly ? 0L : BitLayout.toNanos(fields.subMs());
        try {
            return OptionalLong.of(Math.addExact(
                    Math.multiplyExact(fields.unixTsMs, DefaultValue.NANOS_PER_MILLI), fractionNs));
        } catch (ArithmeticException e) {
            throw new InvalidTimestampException("Timestamp of " + id + " (" + fields.unixTsMs
                    + " ms) is past the signed 64-bit nanosecond range, use extractInstant", e);
        }
    }

    // ==================== Milliseconds ====================

    public OptionalLong extractMillis(String text) {
        return extractMillis(normalize(text));
    }

    /**
     * Returns the 48-bit millisecond timestamp, or empty if not version 7.
     */
    public OptionalLong extractMillis(Uuid7 id) {
        if (!hasTimestamp(id)) {
            return OptionalLong.empty();
        }
        if (id.isNil()) {
            return OptionalLong.of(0L);
        }
        return OptionalLong.of(id.fields().unixTsMs);
    }

    // ==================== Calendar ====================

    public Optional<Instant> extractInstant(String text) {
        return extractInstant(normalize(text), false);
    }

    public Optional<Instant> extractInstant(String text, boolean msOnly) {
        return extractInstant(normalize(text), msOnly);
    }

    public Optional<Instant> extractInstant(UUID uuid, boolean msOnly) {
        return extractInstant(Uuid7.fromUuid(uuid), msOnly);
    }

    /**
     * Returns the embedded timestamp as a UTC instant. Covers the whole 48-bit
     * millisecond range, unlike {@link #extractNanos(Uuid7, boolean)}.
     *
     * @return the instant, or empty if the identifier is not version 7
     * @throws NotVersion7Exception in strict mode when the version is not 7
     */
    public Optional<Instant> extractInstant(Uuid7 id, boolean msOnly) {
        if (!hasTimestamp(id)) {
            return Optional.empty();
        }
        if (id.isNil()) {
            return Optional.of(Instant.EPOCH);
        }
        BitLayout.Fields fields = id.fields();
        Instant instant = Instant.ofEpochMilli(fields.unixTsMs);
        return Optional.of(msOnly ? instant : instant.plusNanos(BitLayout.toNanos(fields.subMs())));
    }

    private boolean hasTimestamp(Uuid7 id) {
        if (id.isNil() && nilAsEpoch) {
            return true;
        }
        if (id.version() == DefaultValue.VERSION) {
            return true;
        }
        if (strict) {
            throw new NotVersion7Exception(id);
        }
        return false;
    }
}
