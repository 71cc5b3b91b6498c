package com.iotfleet.infrastructure.serialization;

import com.iotfleet.pipeline.PipelineException;

/**
 * A payload could not be encoded or decoded. Never transient: the same bytes fail the
 * same way on every attempt.
 */
public class CodecException extends PipelineException {

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
