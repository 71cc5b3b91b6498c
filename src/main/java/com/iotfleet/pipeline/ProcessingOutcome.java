package com.iotfleet.pipeline;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Result of one handler invocation. Drives the consumer's retry loop:
 * SUCCESS commits, RETRYABLE_FAILURE backs off and tries again,
 * TERMINAL_FAILURE dead-letters immediately.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProcessingOutcome {

    private static final ProcessingOutcome SUCCESS = new ProcessingOutcome(Status.SUCCESS, null);

    private final Status status;
    private final Throwable cause;

    public static ProcessingOutcome success() {
        return SUCCESS;
    }

    public static ProcessingOutcome retryable(Throwable cause) {
        return new ProcessingOutcome(Status.RETRYABLE_FAILURE, cause);
    }

    public static ProcessingOutcome terminal(Throwable cause) {
        return new ProcessingOutcome(Status.TERMINAL_FAILURE, cause);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isRetryable() {
        return status == Status.RETRYABLE_FAILURE;
    }

    public boolean isTerminal() {
        return status == Status.TERMINAL_FAILURE;
    }

    @Override
    public String toString() {
        return cause == null ? status.name() : status.name() + "(" + cause.getMessage() + ")";
    }

    public enum Status {
        SUCCESS,
        RETRYABLE_FAILURE,
        TERMINAL_FAILURE
    }
}
