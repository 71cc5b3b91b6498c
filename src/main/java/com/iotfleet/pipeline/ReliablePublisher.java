package com.iotfleet.pipeline;

import com.iotfleet.pipeline.log.LogProducer;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Publishes key/value records to one topic, retrying failed deliveries.
 *
 * Delivery:
 * - Each attempt sends one record and waits for the log's acknowledgment
 * - A failed attempt backs off ({@link BackoffPolicy}) and tries again, up to the attempt
 *   budget of the publisher's {@link Retry} or the deadline, whichever comes first
 * - Exhaustion surfaces as {@link PublishException} carrying the last failure
 *
 * Cancellation:
 * - Checked before every attempt; interrupts the acknowledgment wait and the backoff wait
 * - Always surfaces as {@link CancellationException}, never as the delivery failure
 *
 * Thread-safe: retry state lives on the caller's stack, the producer is shared.
 * {@link #stop()} must not be called while publishes are in flight.
 */
@Slf4j
public class ReliablePublisher {

    private final String name;
    private final String topic;
    private final LogProducer producer;
    private final RetrySettings retrySettings;
    private final Retry retry;
    private final PublisherMetrics metrics;
    private final Clock clock;
    private final ShutdownSignal lifecycle;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public ReliablePublisher(String name, String topic, LogProducer producer,
                             RetrySettings retrySettings, PublisherMetrics metrics, Clock clock) {
        this.name = name;
        this.topic = topic;
        this.producer = producer;
        this.retrySettings = retrySettings;
        this.retry = retrySettings.newRetry(name + "-publish");
        this.metrics = metrics;
        this.clock = clock;
        this.lifecycle = new ShutdownSignal(name + "-publisher");
    }

    /**
     * Publish bounded by this publisher's own lifecycle: {@link #stop()} cancels it.
     */
    public void publish(byte[] key, byte[] value) {
        publish(lifecycle, key, value);
    }

    /**
     * Publish one record, retrying until acknowledged.
     *
     * @throws PublishException      when attempts or the deadline are exhausted
     * @throws CancellationException when the signal is cancelled first
     */
    public void publish(ShutdownSignal signal, byte[] key, byte[] value) {
        if (stopped.get()) {
            throw new IllegalStateException("Publisher " + name + " is stopped");
        }
        RetryState state = RetryState.start(retry, retrySettings.getDeadline(), clock);

        while (true) {
            signal.throwIfCancelled();
            state.beginAttempt();
            if (state.attempts() > 1) {
                metrics.recordRetry();
            }

            long startNanos = System.nanoTime();
            Throwable failure;
            try {
                CompletableFuture<Void> ack = producer.produce(topic, key, value);
                signal.awaitCompletion(ack, state.remaining());
                state.recordSuccess();
                metrics.recordSuccess(value.length, Duration.ofNanos(System.nanoTime() - startNanos));
                log.debug("Published {} bytes to {} (attempt {})", value.length, topic, state.attempts());
                return;
            } catch (CancellationException e) {
                throw e;
            } catch (ExecutionException e) {
                failure = e.getCause() != null ? e.getCause() : e;
            } catch (TimeoutException e) {
                failure = new TimeoutException("No acknowledgment from " + topic + " before the retry deadline");
            } catch (RuntimeException e) {
                failure = e;
            }

            metrics.recordFailure(Duration.ofNanos(System.nanoTime() - startNanos));
            Optional<Duration> backoff = state.recordFailure(failure);

            if (backoff.isEmpty()) {
                metrics.recordExhausted();
                log.error("Giving up publishing to {} after {} attempt(s) in {} ms: {}",
                        topic, state.attempts(), state.elapsed().toMillis(), failure.getMessage());
                throw new PublishException(topic, state.attempts(), failure);
            }

            Duration delay = backoff.get();
            log.warn("Publish to {} failed, retrying after {} ms (attempt {}/{}): {}",
                    topic, delay.toMillis(), state.attempts(), state.maxAttempts(), failure.getMessage());

            if (signal.await(delay)) {
                throw new CancellationException("Publish to " + topic + " cancelled during backoff");
            }
        }
    }

    /**
     * Release the producer connection. Idempotent; cancels publishes made through
     * {@link #publish(byte[], byte[])}.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping publisher {} for topic {}", name, topic);
        lifecycle.cancel();
        producer.close();
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public String name() {
        return name;
    }

    public String topic() {
        return topic;
    }
}
