package com.iotfleet.pipeline;

import lombok.Getter;

/**
 * A publish gave up: every attempt failed, or the retry deadline passed.
 * The cause is the failure of the last attempt.
 */
@Getter
public class PublishException extends PipelineException {

    private final String topic;
    private final int attempts;

    public PublishException(String topic, int attempts, Throwable lastCause) {
        super("Failed to publish to " + topic + " after " + attempts + " attempt(s)"
                + (lastCause != null ? ": " + lastCause.getMessage() : ""), lastCause);
        this.topic = topic;
        this.attempts = attempts;
    }
}
