package com.iotfleet.pipeline;

/**
 * Joining or staying in the consumer group failed (broker unreachable, fatal poll error...).
 * Handled by the consumer's liveness loop, which waits and joins again.
 */
public class JoinException extends PipelineException {

    public JoinException(String message) {
        super(message);
    }

    public JoinException(String message, Throwable cause) {
        super(message, cause);
    }
}
