package com.iotfleet.pipeline.log;

import java.time.Duration;
import java.util.Optional;

/**
 * One partition claimed by this process for the lifetime of a {@link ConsumerSession}.
 * Read from a single dispatch thread.
 */
public interface PartitionClaim {

    TopicPartitionId partition();

    /**
     * Next record in partition order, waiting up to the timeout. Empty when nothing arrived
     * or the claim is closed.
     */
    Optional<LogRecord> poll(Duration timeout);

    /** False once the session ended (revocation or shutdown). */
    boolean isOpen();
}
