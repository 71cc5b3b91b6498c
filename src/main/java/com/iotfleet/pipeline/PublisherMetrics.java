package com.iotfleet.pipeline;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Per-publisher hook points: one call per attempt outcome.
 */
public class PublisherMetrics {

    private final Counter messagesSent;
    private final Counter bytesSent;
    private final Counter errors;
    private final Counter retries;
    private final Counter exhausted;
    private final Timer latency;

    public PublisherMetrics(MeterRegistry meterRegistry, String publisher) {
        this.messagesSent = Counter.builder("publisher.messages.sent")
                .description("Records acknowledged by the log")
                .tag("publisher", publisher)
                .register(meterRegistry);
        this.bytesSent = Counter.builder("publisher.bytes.sent")
                .description("Value bytes acknowledged by the log")
                .tag("publisher", publisher)
                .baseUnit("bytes")
                .register(meterRegistry);
        this.errors = Counter.builder("publisher.errors")
                .description("Failed delivery attempts")
                .tag("publisher", publisher)
                .register(meterRegistry);
        this.retries = Counter.builder("publisher.retries")
                .description("Delivery attempts after the first")
                .tag("publisher", publisher)
                .register(meterRegistry);
        this.exhausted = Counter.builder("publisher.exhausted")
                .description("Publishes that gave up after retries or deadline")
                .tag("publisher", publisher)
                .register(meterRegistry);
        this.latency = Timer.builder("publisher.latency")
                .description("Time from send to acknowledgment or failure, per attempt")
                .tag("publisher", publisher)
                .register(meterRegistry);
    }

    public void recordSuccess(int bytes, Duration elapsed) {
        messagesSent.increment();
        bytesSent.increment(bytes);
        latency.record(elapsed);
    }

    public void recordFailure(Duration elapsed) {
        errors.increment();
        latency.record(elapsed);
    }

    public void recordRetry() {
        retries.increment();
    }

    public void recordExhausted() {
        exhausted.increment();
    }
}
