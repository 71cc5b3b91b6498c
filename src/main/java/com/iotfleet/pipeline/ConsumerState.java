package com.iotfleet.pipeline;

/**
 * Lifecycle of a {@link GroupConsumer}.
 */
public enum ConsumerState {
    IDLE,
    JOINING,
    CLAIMED,
    DRAINING,
    CLOSED
}
