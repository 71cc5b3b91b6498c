package com.iotfleet.infrastructure.messaging;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.common.TopicPartition;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Fetch flow control per partition: pause when a claim buffer fills, resume once it has
 * drained to half. Runs on the poll thread only.
 */
final class PauseResumeController {

    private final int highWatermark;
    private final int lowWatermark;
    private final Set<TopicPartition> paused = new HashSet<>();

    PauseResumeController(int bufferSize) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be at least 1, got " + bufferSize);
        }
        this.highWatermark = bufferSize;
        this.lowWatermark = bufferSize / 2;
    }

    void apply(Consumer<?, ?> consumer, Map<TopicPartition, KafkaPartitionClaim> claims) {
        Set<TopicPartition> toPause = new HashSet<>();
        Set<TopicPartition> toResume = new HashSet<>();

        claims.forEach((tp, claim) -> {
            int buffered = claim.buffered();
            if (paused.contains(tp)) {
                if (buffered <= lowWatermark) {
                    toResume.add(tp);
                }
            } else if (buffered >= highWatermark) {
                toPause.add(tp);
            }
        });

        if (!toPause.isEmpty()) {
            consumer.pause(toPause);
            paused.addAll(toPause);
        }
        if (!toResume.isEmpty()) {
            consumer.resume(toResume);
            paused.removeAll(toResume);
        }
    }

    /** Resume everything; used when a new session starts. */
    void reset(Consumer<?, ?> consumer) {
        Set<TopicPartition> stillPaused = consumer.paused();
        if (!stillPaused.isEmpty()) {
            consumer.resume(stillPaused);
        }
        paused.clear();
    }

    boolean isPaused(TopicPartition tp) {
        return paused.contains(tp);
    }
}
