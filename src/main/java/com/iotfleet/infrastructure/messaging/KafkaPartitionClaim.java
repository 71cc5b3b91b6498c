package com.iotfleet.infrastructure.messaging;

import com.iotfleet.pipeline.log.LogRecord;
import com.iotfleet.pipeline.log.OffsetTracker;
import com.iotfleet.pipeline.log.PartitionClaim;
import com.iotfleet.pipeline.log.TopicPartitionId;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * Buffer between the poll thread and one dispatch thread. The poll thread appends fetched
 * records; the dispatch thread takes them in offset order and registers each as pending.
 */
final class KafkaPartitionClaim implements PartitionClaim {

    private static final LogRecord CLOSED = new LogRecord("", 0, -1L, null, new byte[0]);

    private final TopicPartitionId partition;
    private final OffsetTracker offsets;
    private final LinkedBlockingDeque<LogRecord> buffer = new LinkedBlockingDeque<>();
    private final Object lock = new Object();
    private volatile boolean open = true;
    private long firstDropped = -1L;

    KafkaPartitionClaim(TopicPartitionId partition, OffsetTracker offsets) {
        this.partition = partition;
        this.offsets = offsets;
    }

    @Override
    public TopicPartitionId partition() {
        return partition;
    }

    @Override
    public Optional<LogRecord> poll(Duration timeout) {
        if (!open) {
            return Optional.empty();
        }
        LogRecord record;
        try {
            record = buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
        if (record == null || record == CLOSED) {
            return Optional.empty();
        }
        synchronized (lock) {
            if (!open) {
                dropped(record.offset());
                return Optional.empty();
            }
            offsets.pulled(record);
        }
        return Optional.of(record);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    void append(LogRecord record) {
        buffer.offer(record);
    }

    int buffered() {
        return buffer.size();
    }

    /** Close the claim and drop whatever was fetched but never handed out. */
    void close() {
        synchronized (lock) {
            open = false;
            LogRecord first = buffer.peekFirst();
            if (first != null && first != CLOSED) {
                dropped(first.offset());
            }
            buffer.clear();
            buffer.offer(CLOSED);
        }
    }

    /**
     * Lowest offset fetched but never handed out before the claim closed. Only meaningful
     * once the dispatch thread has exited.
     */
    OptionalLong firstDropped() {
        synchronized (lock) {
            return firstDropped < 0 ? OptionalLong.empty() : OptionalLong.of(firstDropped);
        }
    }

    private void dropped(long offset) {
        if (firstDropped < 0 || offset < firstDropped) {
            firstDropped = offset;
        }
    }
}
