package com.iotfleet.pipeline.log;

import java.util.concurrent.CompletableFuture;

/**
 * Write side of a partitioned log. Must be safe for concurrent use.
 */
public interface LogProducer extends AutoCloseable {

    /**
     * Send one record. The returned future completes when the log acknowledges the write,
     * or exceptionally when delivery fails. Implementations may also throw synchronously.
     */
    CompletableFuture<Void> produce(String topic, byte[] key, byte[] value);

    /** Release the underlying connection. Called once, with no produce in flight. */
    @Override
    void close();
}
