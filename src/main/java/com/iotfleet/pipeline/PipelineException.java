package com.iotfleet.pipeline;

/**
 * Base of the pipeline's own failures. Unchecked, like the rest of the service's error handling.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
