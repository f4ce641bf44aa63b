package com.example.quotemonitor.service.backoff;

import java.time.Duration;

/**
 * Exponential backoff between failed attempts, bounded by {@code [min, max]}.
 * <p>
 * Every {@link #advance()} multiplies the current wait by the growth factor and
 * caps it at the maximum; {@link #reset()} goes back to the minimum. There is
 * no jitter, so the sequence is fully determined by the configuration.
 * <p>
 * Reads of {@link #current()} are safe from any thread (the backoff gauge
 * polls it). {@link #advance()} and {@link #reset()} are not atomic and must
 * run under the check executor's lock.
 */
public class BackoffPolicy {

    private final Duration min;
    private final Duration max;
    private final double factor;

    private volatile Duration current;

    public BackoffPolicy(Duration min, Duration max, double factor) {
        if (min == null || min.isNegative() || min.isZero()) {
            throw new IllegalArgumentException("Backoff minimum must be positive: " + min);
        }
        if (max == null || max.compareTo(min) < 0) {
            throw new IllegalArgumentException("Backoff maximum " + max + " is below minimum " + min);
        }
        if (Double.isNaN(factor) || factor < 1.0) {
            throw new IllegalArgumentException("Backoff factor must be >= 1.0: " + factor);
        }
        this.min = min;
        this.max = max;
        this.factor = factor;
        this.current = min;
    }

    /**
     * Grow the wait and return it.
     *
     * @return the new current wait, never shorter than the previous one
     */
    public Duration advance() {
        double grownNanos = current.toNanos() * factor;
        if (grownNanos >= max.toNanos()) {
            current = max;
        } else {
            current = clamp(Duration.ofNanos(Math.round(grownNanos)));
        }
        return current;
    }

    public void reset() {
        current = min;
    }

    public Duration current() {
        return current;
    }

    public Duration getMin() {
        return min;
    }

    public Duration getMax() {
        return max;
    }

    public double getFactor() {
        return factor;
    }

    private Duration clamp(Duration candidate) {
        if (candidate.compareTo(min) < 0) {
            return min;
        }
        return candidate.compareTo(max) > 0 ? max : candidate;
    }
}
