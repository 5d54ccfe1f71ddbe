package com.uuid7;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last (millisecond, sub-millisecond) slot handed out on one generation channel.
 *
 * <p>Every read-modify-write runs under this instance's monitor, so each
 * channel serialises its own callers without blocking the other channel.
 * The state starts at zero and lives as long as its generator.</p>
 *
 * <p>A live channel samples its clock under the monitor and never hands out an
 * earlier slot: a repeated or lower sub-millisecond value in the same
 * millisecond is bumped past the last one, and a millisecond earlier than the
 * last one is held at the last slot. A replay channel encodes the timestamps it
 * is given, bumping the counter only when a request repeats the last slot
 * exactly. In both modes the counter stops at 2^20-1.</p>
 */
final class MonotonicState {
    private static final Logger logger = LoggerFactory.getLogger(MonotonicState.class);

    private final String name;

    private final boolean live;

    /** Last millisecond handed out */
    private long lastMs = 0L;

    /** Last sub-millisecond value handed out */
    private long lastSubMs = 0L;

    /**
     * @param name label used in log messages
     * @param live {@code true} for a channel fed by a clock, {@code false} for caller-supplied timestamps
     */
    MonotonicState(String name, boolean live) {
        this.name = name;
        this.live = live;
    }

    /**
     * Reads the clock and claims the slot for that instant in one critical
     * section, so concurrent callers observe clock readings in lock order.
     *
     * @throws InvalidTimestampException if the clock returns a negative value
     */
    synchronized Slot advance(EpochNanoClock clock) {
        long timestampNs = clock.epochNanos();
        if (timestampNs < 0) {
            throw new InvalidTimestampException("Clock returned a negative timestamp: " + timestampNs);
        }
        return advance(timestampNs / DefaultValue.NANOS_PER_MILLI,
                BitLayout.toSubMs(timestampNs % DefaultValue.NANOS_PER_MILLI));
    }

    /**
     * Claims the slot for a timestamp and records it as the last one.
     *
     * @param ms    requested millisecond
     * @param subMs requested sub-millisecond value
     * @return the slot to encode
     */
    synchronized Slot advance(long ms, long subMs) {
        if (live) {
            if (ms < lastMs) {
                logger.warn("Clock backward detected on {} channel: {}ms, holding at last timestamp",
                        name, lastMs - ms);
                ms = lastMs;
                subMs = lastSubMs;
            }
            if (ms == lastMs && subMs <= lastSubMs) {
                subMs = bump(ms);
            }
        } else if (ms == lastMs && subMs == lastSubMs) {
            subMs = bump(ms);
        }

        lastMs = ms;
        lastSubMs = subMs;
        return new Slot(ms, subMs);
    }

    private long bump(long ms) {
        if (lastSubMs < DefaultValue.MAX_SUB_MS) {
            return lastSubMs + 1;
        }
        logger.debug("Sub-millisecond counter saturated on {} channel at ms {}", name, ms);
        return DefaultValue.MAX_SUB_MS;
    }

    synchronized Slot last() {
        return new Slot(lastMs, lastSubMs);
    }

    /**
     * A claimed (millisecond, sub-millisecond) pair.
     */
    static final class Slot {
        final long ms;
        final long subMs;

        Slot(long ms, long subMs) {
            this.ms = ms;
            this.subMs = subMs;
        }

        @Override
        public String toString() {
            return "Slot[ms=" + ms + ", subMs=" + subMs + "]";
        }
    }
}
