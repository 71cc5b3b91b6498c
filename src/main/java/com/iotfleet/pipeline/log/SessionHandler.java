package com.iotfleet.pipeline.log;

/**
 * Callbacks a {@link LogConsumerGroup} drives for each session.
 * {@link #consumeClaim} runs on its own thread per claim and returns when the claim closes.
 */
public interface SessionHandler {

    default void onSessionStart(ConsumerSession session) {
    }

    void consumeClaim(ConsumerSession session, PartitionClaim claim);

    default void onSessionEnd(ConsumerSession session) {
    }
}
