package com.uuid7;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Measures how finely candidate clock sources tick.
 *
 * <p>Each source is sampled until it yields 1,000 distinct readings or 500 ms
 * pass. The report gives the observed tick (elapsed time over distinct
 * readings) next to the call cost (elapsed time over calls). A tick much larger
 * than the call cost means identifiers in the same tick rely on the
 * sub-millisecond counter for ordering.</p>
 */
public final class ClockPrecision {
    private static final Logger logger = LoggerFactory.getLogger(ClockPrecision.class);

    /** Stop once this many distinct readings were seen */
    static final int MAX_DISTINCT = 1000;

    /** Stop after this much time per source */
    static final long MAX_ELAPSED_NS = 500_000_000L;

    private ClockPrecision() {
    }

    /**
     * Measures the built-in sources.
     */
    public static List<Sample> measure() {
        return measure(null);
    }

    /**
     * Measures the built-in sources plus an optional user-supplied clock.
     *
     * @param userClock extra clock to measure, may be {@code null}
     */
    public static List<Sample> measure(EpochNanoClock userClock) {
        Map<String, EpochNanoClock> sources = new LinkedHashMap<>();
        sources.put("System.currentTimeMillis()", () -> System.currentTimeMillis() * DefaultValue.NANOS_PER_MILLI);
        sources.put("EpochNanoClock.SYSTEM", EpochNanoClock.SYSTEM);
        if (userClock != null) {
            sources.put("user-supplied", userClock);
        }

        List<Sample> samples = new ArrayList<>(sources.size());
        for (Map.Entry<String, EpochNanoClock> entry : sources.entrySet()) {
            samples.add(sample(entry.getKey(), entry.getValue()));
        }
        return samples;
    }

    /**
     * Measures the sources and returns one report line per source, also logging them.
     */
    public static String report(EpochNanoClock userClock) {
        StringBuilder sb = new StringBuilder();
        for (Sample sample : measure(userClock)) {
            logger.info("{}", sample);
            if (sb.length() > 0) sb.append('\n');
            sb.append(sample);
        }
        return sb.toString();
    }

    static Sample sample(String name, EpochNanoClock source) {
        Set<Long> values = new HashSet<>();
        long calls = 0;
        long start = System.nanoTime();
        long elapsed;
        while (true) {
            values.add(source.epochNanos());
            calls++;
            elapsed = System.nanoTime() - start;
            if (elapsed > MAX_ELAPSED_NS || values.size() >= MAX_DISTINCT) {
                break;
            }
        }
        return new Sample(name, calls, values.size(), elapsed);
    }

    /**
     * Result of sampling one clock source.
     */
    public static final class Sample {
        public final String name;
        public final long calls;
        public final int distinct;
        public final long elapsedNs;

        Sample(String name, long calls, int distinct, long elapsedNs) {
            this.name = name;
            this.calls = calls;
            this.distinct = distinct;
            this.elapsedNs = elapsedNs;
        }

        /** Elapsed time per distinct reading. */
        public double precisionNs() {
            return (double) elapsedNs / distinct;
        }

        /** Elapsed time per call. */
        public double callCostNs() {
            return (double) elapsedNs / calls;
        }

        @Override
        public String toString() {
            return String.format("%s has a timing precision of %,.0fns rather than %,.0fns "
                            + "(%,d samples of which %,d are distinct, in %.2fs)",
                    name, precisionNs(), callCostNs(), calls, distinct, elapsedNs / 1_000_000_000.0);
        }
    }
}
