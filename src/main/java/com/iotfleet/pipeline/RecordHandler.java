package com.iotfleet.pipeline;

import com.iotfleet.pipeline.log.LogRecord;

/**
 * The single capability the consumer is polymorphic over.
 *
 * Implementations either return an outcome or throw: a {@link TerminalHandlerException} is
 * treated as a terminal failure, a {@link java.util.concurrent.CancellationException} abandons
 * the record, any other runtime exception is retried.
 *
 * A handler should honour the signal in its own blocking calls; one that ignores it can stall
 * shutdown until the drain timeout.
 */
@FunctionalInterface
public interface RecordHandler {

    ProcessingOutcome handle(LogRecord record, ShutdownSignal signal);
}
