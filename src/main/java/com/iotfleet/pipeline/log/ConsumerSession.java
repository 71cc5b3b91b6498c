package com.iotfleet.pipeline.log;

import com.iotfleet.pipeline.ShutdownSignal;

import java.util.List;

/**
 * One generation of partition ownership within a consumer group.
 */
public interface ConsumerSession {

    String groupId();

    int generation();

    List<PartitionClaim> claims();

    /** Cancelled when the session ends, by revocation or by shutdown. */
    ShutdownSignal signal();

    /**
     * Mark a record as fully handled. Safe to call from any thread, including after the
     * session ended; marks for partitions no longer owned are dropped.
     */
    void commit(LogRecord record);
}
