package com.iotfleet.pipeline.log;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeSet;

/**
 * Tracks pulled and completed offsets per partition so only the contiguous completed prefix
 * is ever committed.
 *
 * A record is pending from the moment a claim hands it out until its handling completes.
 * The commit position of a partition is its lowest pending offset, or one past the highest
 * completed offset when nothing is pending. Records abandoned during shutdown stay pending,
 * so the position never moves past them and they are redelivered.
 *
 * Thread-safe: claims register pulls from dispatch threads, workers complete from pool
 * threads, the log binding reads positions from its own thread.
 */
public final class OffsetTracker {

    private final Map<TopicPartitionId, PartitionOffsets> partitions = new HashMap<>();

    public synchronized void assign(Collection<TopicPartitionId> assigned) {
        for (TopicPartitionId tp : assigned) {
            partitions.computeIfAbsent(tp, ignored -> new PartitionOffsets());
        }
    }

    public synchronized void revoke(Collection<TopicPartitionId> revoked) {
        for (TopicPartitionId tp : revoked) {
            partitions.remove(tp);
        }
    }

    public synchronized boolean isAssigned(TopicPartitionId tp) {
        return partitions.containsKey(tp);
    }

    public synchronized void pulled(LogRecord record) {
        PartitionOffsets offsets = partitions.get(record.source());
        if (offsets != null) {
            offsets.pending.add(record.offset());
        }
    }

    /**
     * @return false when the partition is no longer assigned and the mark was dropped
     */
    public synchronized boolean completed(LogRecord record) {
        PartitionOffsets offsets = partitions.get(record.source());
        if (offsets == null) {
            return false;
        }
        offsets.pending.remove(record.offset());
        offsets.next = Math.max(offsets.next, record.offset() + 1);
        return true;
    }

    /** Commit positions that moved since the last {@link #committed} call. */
    public synchronized Map<TopicPartitionId, Long> committable() {
        return committable(partitions.keySet());
    }

    public synchronized Map<TopicPartitionId, Long> committable(Collection<TopicPartitionId> subset) {
        Map<TopicPartitionId, Long> result = new HashMap<>();
        for (TopicPartitionId tp : subset) {
            PartitionOffsets offsets = partitions.get(tp);
            if (offsets == null) {
                continue;
            }
            long position = offsets.position();
            if (position > offsets.committed) {
                result.put(tp, position);
            }
        }
        return result;
    }

    /** Record positions the log has accepted. */
    public synchronized void committed(Map<TopicPartitionId, Long> positions) {
        positions.forEach((tp, position) -> {
            PartitionOffsets offsets = partitions.get(tp);
            if (offsets != null) {
                offsets.committed = Math.max(offsets.committed, position);
            }
        });
    }

    /**
     * Lowest offset handed out but not yet completed. A partition kept across a rebalance is
     * rewound here so records still in flight are not skipped.
     */
    public synchronized OptionalLong firstPending(TopicPartitionId tp) {
        PartitionOffsets offsets = partitions.get(tp);
        if (offsets == null || offsets.pending.isEmpty()) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(offsets.pending.first());
    }

    public synchronized int pendingCount(TopicPartitionId tp) {
        PartitionOffsets offsets = partitions.get(tp);
        return offsets == null ? 0 : offsets.pending.size();
    }

    private static final class PartitionOffsets {
        private final TreeSet<Long> pending = new TreeSet<>();
        private long next = -1;
        private long committed = -1;

        long position() {
            if (!pending.isEmpty()) {
                return pending.first();
            }
            return next;
        }
    }
}
