package com.iotfleet.pipeline.log;

import com.iotfleet.pipeline.JoinException;
import com.iotfleet.pipeline.ShutdownSignal;

import java.util.List;

/**
 * Read side of a partitioned log with consumer-group semantics.
 */
public interface LogConsumerGroup extends AutoCloseable {

    String groupId();

    List<String> topics();

    /**
     * Join the group and run sessions, one per assignment generation, calling the handler for
     * each claim. Blocks until the signal is cancelled (returns normally) or membership fails
     * (throws {@link JoinException}). May be called again after a failure to rejoin.
     */
    void consume(ShutdownSignal signal, SessionHandler handler) throws JoinException;

    /** Commit what has been marked and leave the group. Idempotent. */
    @Override
    void close();
}
