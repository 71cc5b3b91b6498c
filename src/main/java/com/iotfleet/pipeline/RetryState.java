package com.iotfleet.pipeline;

import io.github.resilience4j.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Per-record (or per-publish) retry bookkeeping over one Resilience4j retry context.
 *
 * The context decides whether another attempt is allowed and how long to back off; this
 * class adds the overall deadline, which clips every backoff and ends retrying once passed.
 * The wait itself is left to the caller so it can observe a {@link ShutdownSignal}.
 *
 * Confined to the thread running the attempts; never shared, so it is not synchronized.
 */
public final class RetryState {

    private final Retry.AsyncContext<Object> context;
    private final int maxAttempts;
    private final Clock clock;
    private final Instant firstAttemptAt;
    private final Instant deadline;
    private int attempts;
    private boolean exhausted;
    private Throwable lastFailure;

    private RetryState(Retry retry, Duration deadline, Clock clock) {
        this.context = retry.asyncContext();
        this.maxAttempts = retry.getRetryConfig().getMaxAttempts();
        this.clock = clock;
        this.firstAttemptAt = clock.instant();
        this.deadline = firstAttemptAt.plus(deadline);
    }

    public static RetryState start(Retry retry, Duration deadline, Clock clock) {
        return new RetryState(retry, deadline, clock);
    }

    /** Record that an attempt is about to run. */
    public void beginAttempt() {
        attempts++;
    }

    public void recordSuccess() {
        context.onComplete();
    }

    /**
     * Record a failed attempt.
     *
     * @return the backoff before the next attempt, clipped to the deadline; empty when the
     * attempts are spent or the deadline has passed
     */
    public Optional<Duration> recordFailure(Throwable cause) {
        lastFailure = cause;
        long interval = context.onError(cause);
        if (interval < 0 || isPastDeadline()) {
            exhausted = true;
            return Optional.empty();
        }
        Duration delay = Duration.ofMillis(interval);
        Duration remaining = remaining();
        return Optional.of(delay.compareTo(remaining) > 0 ? remaining : delay);
    }

    public boolean isExhausted() {
        return exhausted;
    }

    public boolean isPastDeadline() {
        return !clock.instant().isBefore(deadline);
    }

    public Duration remaining() {
        Duration remaining = Duration.between(clock.instant(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public Duration elapsed() {
        return Duration.between(firstAttemptAt, clock.instant());
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Throwable lastFailure() {
        return lastFailure;
    }

    public Instant deadline() {
        return deadline;
    }
}
