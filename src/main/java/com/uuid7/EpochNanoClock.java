package com.uuid7;

import java.time.Clock;
import java.time.Instant;

/**
 * Wall-clock source for identifier generation.
 *
 * <p>Implementations return nanoseconds since the Unix epoch. The value may
 * step backwards between calls; the generator tolerates that. Resolution is
 * platform dependent, see {@link ClockPrecision}.</p>
 */
@FunctionalInterface
public interface EpochNanoClock {

    /** System UTC clock through {@link java.time}, typically microsecond resolution. */
    EpochNanoClock SYSTEM = new EpochNanoClock() {
        private final Clock clock = Clock.systemUTC();

        @Override
        public long epochNanos() {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        }

        @Override
        public String toString() {
            return "EpochNanoClock.SYSTEM";
        }
    };

    /**
     * Returns the current time in nanoseconds since 1970-01-01T00:00:00Z.
     */
    long epochNanos();
}
