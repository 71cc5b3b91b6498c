package com.iotfleet.pipeline;

/**
 * Thrown by a handler for a record that can never succeed (malformed payload, failed
 * validation). The record goes straight to the dead-letter stream without using its retry budget.
 */
public class TerminalHandlerException extends PipelineException {

    public TerminalHandlerException(String message) {
        super(message);
    }

    public TerminalHandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
