package com.iotfleet.pipeline;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.Getter;

import java.time.Duration;

/**
 * Retry budget shared by the consumer retry loop and the reliable publisher:
 * a maximum number of attempts, an overall deadline measured from the first attempt,
 * and the backoff between attempts.
 *
 * Attempt counting and backoff are delegated to a Resilience4j {@link Retry}; the deadline
 * is enforced per call by {@link RetryState}.
 */
@Getter
public final class RetrySettings {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_DEADLINE = Duration.ofMinutes(2);

    private final int maxAttempts;
    private final Duration deadline;
    private final BackoffPolicy backoff;

    public RetrySettings(int maxAttempts, Duration deadline, BackoffPolicy backoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        if (deadline == null || deadline.isNegative() || deadline.isZero()) {
            throw new IllegalArgumentException("deadline must be positive: " + deadline);
        }
        this.maxAttempts = maxAttempts;
        this.deadline = deadline;
        this.backoff = backoff;
    }

    public static RetrySettings defaults() {
        return new RetrySettings(DEFAULT_MAX_ATTEMPTS, DEFAULT_DEADLINE, BackoffPolicy.defaults());
    }

    public RetryConfig toRetryConfig() {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(backoff)
                .build();
    }

    /** A named Resilience4j retry over these settings. */
    public Retry newRetry(String name) {
        return Retry.of(name, toRetryConfig());
    }

    @Override
    public String toString() {
        return "RetrySettings[maxAttempts=" + maxAttempts + ", deadline=" + deadline
                + ", backoffBase=" + backoff.base() + "]";
    }
}
