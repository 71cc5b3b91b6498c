package com.iotfleet.pipeline;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with multiplicative jitter.
 *
 * delay(i) = base * 2^i * U[1 - jitter, 1 + jitter], with i the 0-based attempt index.
 *
 * There is no cap on the exponent; callers bound retries with a maximum attempt count and a
 * deadline. The random source is injectable so tests can seed it.
 *
 * Also usable as a Resilience4j {@link IntervalFunction}, which numbers attempts from 1.
 */
public final class BackoffPolicy implements IntervalFunction {

    public static final Duration DEFAULT_BASE = Duration.ofMillis(100);
    public static final double DEFAULT_JITTER = 0.2;

    private final Duration base;
    private final double jitter;
    private final DoubleSupplier random;

    public BackoffPolicy(Duration base, double jitter, DoubleSupplier random) {
        if (base == null || base.isNegative()) {
            throw new IllegalArgumentException("Backoff base must be non-negative: " + base);
        }
        if (jitter < 0.0 || jitter >= 1.0) {
            throw new IllegalArgumentException("Jitter must be in [0, 1): " + jitter);
        }
        this.base = base;
        this.jitter = jitter;
        this.random = random;
    }

    public BackoffPolicy(Duration base, double jitter) {
        this(base, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(DEFAULT_BASE, DEFAULT_JITTER);
    }

    /**
     * Delay to wait after the given failed attempt.
     *
     * @param attempt 0-based attempt index
     */
    public Duration delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt index must be >= 0: " + attempt);
        }
        double exponential = base.toNanos() * Math.pow(2, attempt);
        double factor = (1.0 - jitter) + (2.0 * jitter * random.getAsDouble());
        double nanos = Math.min(exponential * factor, (double) Long.MAX_VALUE);
        return Duration.ofNanos((long) nanos);
    }

    /** Lower bound of {@link #delay(int)} for the attempt. */
    public Duration minDelay(int attempt) {
        return Duration.ofNanos((long) (base.toNanos() * Math.pow(2, attempt) * (1.0 - jitter)));
    }

    /** Upper bound of {@link #delay(int)} for the attempt. */
    public Duration maxDelay(int attempt) {
        return Duration.ofNanos((long) (base.toNanos() * Math.pow(2, attempt) * (1.0 + jitter)));
    }

    @Override
    public Long apply(Integer numOfAttempts) {
        return delay(Math.max(0, numOfAttempts - 1)).toMillis();
    }

    public Duration base() {
        return base;
    }

    public double jitter() {
        return jitter;
    }
}
