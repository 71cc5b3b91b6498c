package com.iotfleet.infrastructure.messaging;

import com.iotfleet.pipeline.JoinException;
import com.iotfleet.pipeline.ShutdownSignal;
import com.iotfleet.pipeline.log.ConsumerSession;
import com.iotfleet.pipeline.log.LogConsumerGroup;
import com.iotfleet.pipeline.log.LogRecord;
import com.iotfleet.pipeline.log.OffsetTracker;
import com.iotfleet.pipeline.log.PartitionClaim;
import com.iotfleet.pipeline.log.SessionHandler;
import com.iotfleet.pipeline.log.TopicPartitionId;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.springframework.kafka.core.ConsumerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link LogConsumerGroup} over a Kafka consumer.
 *
 * Architecture:
 * - The calling thread owns the Kafka consumer and runs the poll loop
 * - Fetched records are routed into one buffer per assigned partition; each buffer is read
 *   by its own claim thread
 * - A partition whose buffer fills is paused, and resumed once it drains to half
 * - Offsets are committed from the {@link OffsetTracker}: asynchronously on an interval,
 *   synchronously before partitions are revoked and on close
 *
 * Rebalance: any revocation, and any assignment that adds partitions, ends the current
 * session (claims closed, claim threads joined); a new session then starts over the full
 * assignment. An incremental assignment that adds nothing keeps the running session.
 * Partitions kept across a rebalance are rewound to the first record not yet completed.
 *
 * Failure Handling:
 * - Broker or membership errors discard the consumer and surface as {@link JoinException};
 *   the next {@link #consume} call joins with a fresh consumer
 * - Marks for partitions lost in the meantime are dropped, their records are redelivered
 */
@Slf4j
public class KafkaConsumerGroup implements LogConsumerGroup {

    public static final Duration DEFAULT_COMMIT_INTERVAL = Duration.ofSeconds(1);
    public static final int DEFAULT_PARTITION_BUFFER_SIZE = 500;
    public static final Duration DEFAULT_CLAIM_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private static final Duration FETCH_TIMEOUT = Duration.ofMillis(100);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

    private final ConsumerFactory<byte[], byte[]> consumerFactory;
    private final String groupId;
    private final List<String> topics;
    private final Duration commitInterval;
    private final int partitionBufferSize;
    private final Duration claimShutdownTimeout;

    private final OffsetTracker offsets = new OffsetTracker();
    private final AtomicInteger generations = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Object consumerLock = new Object();
    private Consumer<byte[], byte[]> consumer;

    @Builder
    private KafkaConsumerGroup(ConsumerFactory<byte[], byte[]> consumerFactory,
                               String groupId,
                               List<String> topics,
                               Duration commitInterval,
                               Integer partitionBufferSize,
                               Duration claimShutdownTimeout) {
        this.consumerFactory = Objects.requireNonNull(consumerFactory, "consumerFactory");
        this.groupId = Objects.requireNonNull(groupId, "groupId");
        if (topics == null || topics.isEmpty()) {
            throw new IllegalArgumentException("At least one topic is required for group " + groupId);
        }
        this.topics = List.copyOf(topics);
        this.commitInterval = commitInterval != null ? commitInterval : DEFAULT_COMMIT_INTERVAL;
        this.partitionBufferSize = partitionBufferSize != null ? partitionBufferSize : DEFAULT_PARTITION_BUFFER_SIZE;
        this.claimShutdownTimeout = claimShutdownTimeout != null ? claimShutdownTimeout : DEFAULT_CLAIM_SHUTDOWN_TIMEOUT;
    }

    @Override
    public String groupId() {
        return groupId;
    }

    @Override
    public List<String> topics() {
        return topics;
    }

    @Override
    public void consume(ShutdownSignal signal, SessionHandler handler) throws JoinException {
        if (closed.get()) {
            throw new IllegalStateException("Consumer group " + groupId + " is closed");
        }
        if (signal.isCancelled()) {
            return;
        }

        Consumer<byte[], byte[]> kafka = connect();
        PollLoop loop = new PollLoop(kafka, signal, handler);
        try (ShutdownSignal.Registration ignored = signal.register(kafka::wakeup)) {
            kafka.subscribe(topics, loop);
            loop.run();
        } catch (WakeupException e) {
            log.debug("Poll loop for group {} woken for shutdown", groupId);
        } catch (KafkaException e) {
            loop.endSession();
            discard(kafka);
            throw new JoinException("Consumer group " + groupId + " failed: " + e.getMessage(), e);
        } finally {
            loop.endSession();
        }
    }

    /**
     * Commit whatever completed while in-flight records drained, then leave the group.
     * Must not run concurrently with {@link #consume}.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Consumer<byte[], byte[]> kafka;
        synchronized (consumerLock) {
            kafka = consumer;
            consumer = null;
        }
        if (kafka == null) {
            return;
        }
        try {
            commitSync(kafka, offsets.committable());
        } catch (KafkaException e) {
            log.error("Final commit for group {} failed: {}", groupId, e.getMessage(), e);
        }
        try {
            kafka.close(CLOSE_TIMEOUT);
            log.info("Left consumer group {}", groupId);
        } catch (KafkaException e) {
            log.error("Failed to close consumer for group {}: {}", groupId, e.getMessage(), e);
        }
    }

    private Consumer<byte[], byte[]> connect() {
        synchronized (consumerLock) {
            if (consumer == null) {
                try {
                    consumer = consumerFactory.createConsumer(groupId, null);
                } catch (KafkaException e) {
                    throw new JoinException("Unable to create consumer for group " + groupId + ": " + e.getMessage(), e);
                }
                log.info("Joining consumer group {} for topics {}", groupId, topics);
            }
            return consumer;
        }
    }

    private void discard(Consumer<byte[], byte[]> kafka) {
        synchronized (consumerLock) {
            if (consumer == kafka) {
                consumer = null;
            }
        }
        offsets.revoke(ids(kafka.assignment()));
        try {
            kafka.close(Duration.ZERO);
        } catch (KafkaException e) {
            log.warn("Error while discarding consumer for group {}: {}", groupId, e.getMessage());
        }
    }

    /** Commit synchronously. A pending shutdown wakeup is consumed by the first attempt. */
    private void commitSync(Consumer<byte[], byte[]> kafka, Map<TopicPartitionId, Long> positions) {
        if (positions.isEmpty()) {
            return;
        }
        Map<TopicPartition, OffsetAndMetadata> request = toKafka(positions);
        try {
            kafka.commitSync(request);
        } catch (WakeupException e) {
            kafka.commitSync(request);
        }
        offsets.committed(positions);
        log.debug("Committed {} for group {}", positions, groupId);
    }

    private static Map<TopicPartition, OffsetAndMetadata> toKafka(Map<TopicPartitionId, Long> positions) {
        Map<TopicPartition, OffsetAndMetadata> request = new HashMap<>();
        positions.forEach((tp, position) ->
                request.put(new TopicPartition(tp.topic(), tp.partition()), new OffsetAndMetadata(position)));
        return request;
    }

    private static TopicPartitionId id(TopicPartition tp) {
        return new TopicPartitionId(tp.topic(), tp.partition());
    }

    private static List<TopicPartitionId> ids(Collection<TopicPartition> partitions) {
        List<TopicPartitionId> result = new ArrayList<>(partitions.size());
        for (TopicPartition tp : partitions) {
            result.add(id(tp));
        }
        return result;
    }

    private static LogRecord toLogRecord(ConsumerRecord<byte[], byte[]> record) {
        return new LogRecord(record.topic(), record.partition(), record.offset(), record.key(), record.value());
    }

    /** Poll loop and rebalance callbacks. Everything here runs on the consuming thread. */
    private final class PollLoop implements ConsumerRebalanceListener {

        private final Consumer<byte[], byte[]> kafka;
        private final ShutdownSignal signal;
        private final SessionHandler handler;
        private final PauseResumeController flowControl = new PauseResumeController(partitionBufferSize);
        private KafkaSession current;
        private long lastCommitNanos = System.nanoTime();

        PollLoop(Consumer<byte[], byte[]> kafka, ShutdownSignal signal, SessionHandler handler) {
            this.kafka = kafka;
            this.signal = signal;
            this.handler = handler;
        }

        void run() {
            while (!signal.isCancelled()) {
                ConsumerRecords<byte[], byte[]> records = kafka.poll(FETCH_TIMEOUT);
                route(records);
                if (current != null) {
                    flowControl.apply(kafka, current.claimsByPartition);
                }
                commitIfDue();
            }
        }

        private void route(ConsumerRecords<byte[], byte[]> records) {
            for (TopicPartition tp : records.partitions()) {
                List<ConsumerRecord<byte[], byte[]>> batch = records.records(tp);
                KafkaPartitionClaim claim = current == null ? null : current.claimsByPartition.get(tp);
                if (claim == null) {
                    long first = batch.get(0).offset();
                    log.warn("Fetched {} record(s) for unclaimed partition {}; seeking back to {}", batch.size(), tp, first);
                    kafka.seek(tp, first);
                    continue;
                }
                for (ConsumerRecord<byte[], byte[]> record : batch) {
                    claim.append(toLogRecord(record));
                }
            }
        }

        private void commitIfDue() {
            long now = System.nanoTime();
            if (now - lastCommitNanos < commitInterval.toNanos()) {
                return;
            }
            lastCommitNanos = now;
            Map<TopicPartitionId, Long> positions = offsets.committable();
            if (positions.isEmpty()) {
                return;
            }
            kafka.commitAsync(toKafka(positions), (committed, error) -> {
                if (error == null) {
                    offsets.committed(positions);
                } else {
                    log.warn("Async commit for group {} failed, will retry: {}", groupId, error.getMessage());
                }
            });
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
            if (current != null && partitions.isEmpty()) {
                log.debug("Group {} rebalanced without changes to generation {}", groupId, current.generation);
                return;
            }
            KafkaSession previous = endSession();
            if (previous != null) {
                commitSync(kafka, offsets.committable());
                rewind(previous, previous.claimsByPartition.keySet());
            }

            offsets.assign(ids(partitions));
            Set<TopicPartition> owned = kafka.assignment();
            if (owned.isEmpty()) {
                log.info("No partitions assigned to this member of group {}", groupId);
                return;
            }
            flowControl.reset(kafka);
            current = new KafkaSession(generations.incrementAndGet(), owned, signal);
            log.info("Group {} assigned {} (generation {})", groupId, owned, current.generation);
            handler.onSessionStart(current);
            current.startClaims(handler);
        }

        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
            Set<TopicPartition> retained = new HashSet<>(kafka.assignment());
            retained.removeAll(partitions);
            log.info("Group {} revoking {}", groupId, partitions);

            KafkaSession ended = endSession();
            commitSync(kafka, offsets.committable());
            offsets.revoke(ids(partitions));
            if (ended != null) {
                rewind(ended, retained);
            }
        }

        @Override
        public void onPartitionsLost(Collection<TopicPartition> partitions) {
            log.warn("Group {} lost {}; uncommitted records will be redelivered elsewhere", groupId, partitions);
            Set<TopicPartition> retained = new HashSet<>(kafka.assignment());
            retained.removeAll(partitions);

            KafkaSession ended = endSession();
            offsets.revoke(ids(partitions));
            if (ended != null) {
                rewind(ended, retained);
            }
        }

        KafkaSession endSession() {
            KafkaSession ended = current;
            if (ended == null) {
                return null;
            }
            current = null;
            ended.end();
            handler.onSessionEnd(ended);
            return ended;
        }

        private void rewind(KafkaSession ended, Set<TopicPartition> retained) {
            for (TopicPartition tp : retained) {
                OptionalLong pending = offsets.firstPending(id(tp));
                KafkaPartitionClaim claim = ended.claimsByPartition.get(tp);
                OptionalLong dropped = claim == null ? OptionalLong.empty() : claim.firstDropped();
                long target = Long.MAX_VALUE;
                if (pending.isPresent()) {
                    target = pending.getAsLong();
                }
                if (dropped.isPresent()) {
                    target = Math.min(target, dropped.getAsLong());
                }
                if (target != Long.MAX_VALUE) {
                    log.debug("Rewinding retained partition {} to {}", tp, target);
                    kafka.seek(tp, target);
                }
            }
        }
    }

    private final class KafkaSession implements ConsumerSession {

        private final int generation;
        private final Map<TopicPartition, KafkaPartitionClaim> claimsByPartition = new LinkedHashMap<>();
        private final List<PartitionClaim> claims;
        private final ShutdownSignal sessionSignal;
        private final ShutdownSignal.Registration parentLink;
        private final ExecutorService claimThreads;

        KafkaSession(int generation, Collection<TopicPartition> owned, ShutdownSignal parent) {
            this.generation = generation;
            for (TopicPartition tp : owned) {
                claimsByPartition.put(tp, new KafkaPartitionClaim(id(tp), offsets));
            }
            this.claims = Collections.unmodifiableList(new ArrayList<>(claimsByPartition.values()));
            this.sessionSignal = new ShutdownSignal(groupId + "-generation-" + generation);
            this.parentLink = parent.register(sessionSignal::cancel);
            AtomicInteger threadIndex = new AtomicInteger();
            this.claimThreads = Executors.newCachedThreadPool(runnable -> {
                Thread thread = new Thread(runnable, groupId + "-claim-" + generation + "-" + threadIndex.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
        }

        void startClaims(SessionHandler handler) {
            for (KafkaPartitionClaim claim : claimsByPartition.values()) {
                claimThreads.execute(() -> {
                    try {
                        handler.consumeClaim(this, claim);
                    } catch (RuntimeException e) {
                        log.error("Claim loop for {} failed: {}", claim.partition(), e.getMessage(), e);
                    }
                });
            }
        }

        void end() {
            sessionSignal.cancel();
            parentLink.close();
            claimsByPartition.values().forEach(KafkaPartitionClaim::close);
            claimThreads.shutdown();
            try {
                if (!claimThreads.awaitTermination(claimShutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Claim threads of generation {} still running after {}", generation, claimShutdownTimeout);
                    claimThreads.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                claimThreads.shutdownNow();
            }
        }

        @Override
        public String groupId() {
            return groupId;
        }

        @Override
        public int generation() {
            return generation;
        }

        @Override
        public List<PartitionClaim> claims() {
            return claims;
        }

        @Override
        public ShutdownSignal signal() {
            return sessionSignal;
        }

        @Override
        public void commit(LogRecord record) {
            if (!offsets.completed(record)) {
                log.debug("Dropped completion of {}: partition no longer owned by group member", record);
            }
        }
    }
}
