package com.iotfleet.pipeline;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Consumer-side hook points: records in, outcomes, retries, dead-lettering, group membership.
 */
public class ConsumerMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter received;
    private final Counter bytesReceived;
    private final Counter retries;
    private final Counter joinFailures;
    private final Counter deadLetterFailures;
    private final Timer processingLatency;

    public ConsumerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.received = Counter.builder("pipeline.messages.received")
                .description("Records pulled from claimed partitions")
                .register(meterRegistry);
        this.bytesReceived = Counter.builder("pipeline.bytes.received")
                .baseUnit("bytes")
                .register(meterRegistry);
        this.retries = Counter.builder("pipeline.retries")
                .description("Handler invocations after the first for a record")
                .register(meterRegistry);
        this.joinFailures = Counter.builder("pipeline.join.failures")
                .description("Failed attempts to join or stay in the consumer group")
                .register(meterRegistry);
        this.deadLetterFailures = Counter.builder("pipeline.dead_letter.failures")
                .description("Records that could not be written to the dead-letter stream")
                .register(meterRegistry);
        this.processingLatency = Timer.builder("pipeline.processing.latency")
                .description("Time from first handler attempt to terminal outcome")
                .register(meterRegistry);
    }

    public void bindWorkerPool(BoundedWorkerPool pool) {
        Gauge.builder("pipeline.workers.in_use", pool, BoundedWorkerPool::inUse)
                .description("Worker slots currently held")
                .tag("pool", pool.name())
                .register(meterRegistry);
        Gauge.builder("pipeline.workers.capacity", pool, BoundedWorkerPool::capacity)
                .tag("pool", pool.name())
                .register(meterRegistry);
    }

    public void recordReceived(int bytes) {
        received.increment();
        bytesReceived.increment(bytes);
    }

    public void recordRetry() {
        retries.increment();
    }

    public void recordOutcome(String result, Duration elapsed) {
        Counter.builder("pipeline.messages.processed")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
        processingLatency.record(elapsed);
    }

    public void recordDeadLetter(String reason) {
        Counter.builder("pipeline.dead_letter")
                .description("Records routed to the dead-letter stream")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordDeadLetterFailure() {
        deadLetterFailures.increment();
    }

    public void recordJoinFailure() {
        joinFailures.increment();
    }
}
