package com.syncwatch.common;

import java.time.Duration;

/**
 * Poll interval schedule for refresh jobs: initial interval, multiplied by {@code factor} after every
 * {@code growthEveryChecks} probes, capped at {@code maxInterval}.
 * Pure function of the probe count so it can be tested without timers.
 */
public final class PollBackoff {

    private final Duration initialInterval;
    private final double factor;
    private final Duration maxInterval;
    private final int growthEveryChecks;

    public PollBackoff(Duration initialInterval, double factor, Duration maxInterval, int growthEveryChecks) {
        if (initialInterval == null || initialInterval.isNegative() || initialInterval.isZero()) {
            throw new IllegalArgumentException("initialInterval must be positive");
        }
        if (maxInterval == null || maxInterval.compareTo(initialInterval) < 0) {
            throw new IllegalArgumentException("maxInterval must be >= initialInterval");
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("factor must be >= 1.0");
        }
        if (growthEveryChecks <= 0) {
            throw new IllegalArgumentException("growthEveryChecks must be positive");
        }
        this.initialInterval = initialInterval;
        this.factor = factor;
        this.maxInterval = maxInterval;
        this.growthEveryChecks = growthEveryChecks;
    }

    /**
     * Interval to wait before the next probe, given how many probes were already made.
     * Formula: min(initial * factor^(checkCount / growthEveryChecks), max).
     */
    public Duration intervalFor(int checkCount) {
        if (checkCount < growthEveryChecks) {
            return initialInterval;
        }
        int steps = Math.min(checkCount / growthEveryChecks, 64);
        double nanos = initialInterval.toNanos() * Math.pow(factor, steps);
        if (nanos >= maxInterval.toNanos()) {
            return maxInterval;
        }
        return Duration.ofNanos((long) nanos);
    }

    public Duration getInitialInterval() {
        return initialInterval;
    }

    public Duration getMaxInterval() {
        return maxInterval;
    }

    public double getFactor() {
        return factor;
    }

    public int getGrowthEveryChecks() {
        return growthEveryChecks;
    }

    /**
     * Default: 1s initial, x1.5 every 3rd probe, 5s ceiling.
     */
    public static PollBackoff defaultBackoff() {
        return new PollBackoff(Duration.ofSeconds(1), 1.5, Duration.ofSeconds(5), 3);
    }
}
