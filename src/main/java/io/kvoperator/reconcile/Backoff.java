package io.kvoperator.reconcile;

import java.time.Duration;

/**
 * Exponential retry delay: base, 2 x base, 4 x base, ... capped at max.
 */
public class Backoff {

    private final Duration base;
    private final Duration max;

    public Backoff(Duration base, Duration max) {
        if (base.isNegative() || base.isZero() || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("Backoff requires 0 < base <= max, got " + base + " and " + max);
        }
        this.base = base;
        this.max = max;
    }

    /**
     * @param failures consecutive failures so far, at least 1
     */
    public Duration delay(int failures) {
        int exponent = Math.max(0, failures - 1);
        // past 2^30 the cap has long been reached
        if (exponent >= 30) {
            return max;
        }
        long millis = base.toMillis() << exponent;
        return millis <= 0 || millis > max.toMillis() ? max : Duration.ofMillis(millis);
    }
}
