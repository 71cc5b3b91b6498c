package com.iotfleet.pipeline;

import com.iotfleet.pipeline.log.ConsumerSession;
import com.iotfleet.pipeline.log.LogConsumerGroup;
import com.iotfleet.pipeline.log.LogRecord;
import com.iotfleet.pipeline.log.PartitionClaim;
import com.iotfleet.pipeline.log.SessionHandler;
import io.github.resilience4j.retry.Retry;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Consumer-group member that dispatches every record to a handler under a worker-pool cap.
 *
 * Liveness:
 * - A dedicated thread joins the group and runs its sessions
 * - If joining or membership fails, it logs, waits a fixed interval and joins again,
 *   for as long as the consumer runs
 *
 * Dispatch (one thread per claimed partition, records pulled in partition order):
 * 1. Acquire a worker slot; the next record is not pulled until this succeeds
 * 2. Run the handler on the worker pool
 * 3. Success: commit
 * 4. Retryable failure: back off and retry until attempts or deadline run out
 * 5. Exhausted, or terminal failure: send the original record to the dead-letter
 *    publisher (best effort) and commit, so a poison record cannot block its partition
 * 6. The slot is released on every path
 *
 * Delivery is at-least-once: a record is committed only after a terminal outcome, and a
 * record abandoned by shutdown is left uncommitted and redelivered after restart.
 *
 * Shutdown ({@link #stop()}): stop pulling, drain in-flight records, then leave the group.
 * Every wait in the drain shares one deadline, the drain timeout; a handler that never
 * honours cancellation holds it up until then.
 */
@Slf4j
public class GroupConsumer {

    public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(500);
    public static final Duration DEFAULT_REJOIN_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofSeconds(30);

    private final LogConsumerGroup group;
    private final RecordHandler handler;
    private final BoundedWorkerPool workerPool;
    private final RetrySettings retrySettings;
    private final Retry handlerRetry;
    private final ReliablePublisher deadLetterPublisher;
    private final ConsumerMetrics metrics;
    private final Clock clock;
    private final Duration pollTimeout;
    private final Duration rejoinInterval;
    private final Duration drainTimeout;

    private final ShutdownSignal signal;
    private final AtomicReference<ConsumerState> state = new AtomicReference<>(ConsumerState.IDLE);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile Thread livenessThread;

    @Builder
    private GroupConsumer(LogConsumerGroup group,
                          RecordHandler handler,
                          BoundedWorkerPool workerPool,
                          RetrySettings retrySettings,
                          ReliablePublisher deadLetterPublisher,
                          ConsumerMetrics metrics,
                          Clock clock,
                          Duration pollTimeout,
                          Duration rejoinInterval,
                          Duration drainTimeout) {
        this.group = Objects.requireNonNull(group, "group");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool");
        this.deadLetterPublisher = Objects.requireNonNull(deadLetterPublisher, "deadLetterPublisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.retrySettings = retrySettings != null ? retrySettings : RetrySettings.defaults();
        this.handlerRetry = this.retrySettings.newRetry("handler-" + group.groupId());
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.pollTimeout = pollTimeout != null ? pollTimeout : DEFAULT_POLL_TIMEOUT;
        this.rejoinInterval = rejoinInterval != null ? rejoinInterval : DEFAULT_REJOIN_INTERVAL;
        this.drainTimeout = drainTimeout != null ? drainTimeout : DEFAULT_DRAIN_TIMEOUT;
        this.signal = new ShutdownSignal("consumer-" + group.groupId());
        metrics.bindWorkerPool(workerPool);
    }

    /** Start the liveness thread. May be called once. */
    public void start() {
        if (!state.compareAndSet(ConsumerState.IDLE, ConsumerState.JOINING)) {
            throw new IllegalStateException("Consumer for group " + group.groupId() + " already started");
        }
        log.info("Starting consumer for group {} on topics {} (workers={}, {})",
                group.groupId(), group.topics(), workerPool.capacity(), retrySettings);
        Thread thread = new Thread(this::runLivenessLoop, "group-consumer-" + group.groupId());
        thread.setDaemon(false);
        livenessThread = thread;
        thread.start();
    }

    /**
     * Stop pulling, wait for in-flight records, leave the group. Idempotent, and safe to call
     * before {@link #start()}.
     */
    public void stop() {
        if (!stopRequested.compareAndSet(false, true)) {
            return;
        }
        ConsumerState previous = state.getAndSet(ConsumerState.DRAINING);
        log.info("Stopping consumer for group {} (was {}, {} record(s) in flight)",
                group.groupId(), previous, workerPool.inUse());

        signal.cancel();
        long drainDeadline = System.nanoTime() + drainTimeout.toNanos();

        Thread thread = livenessThread;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(Math.max(1L, remainingUntil(drainDeadline).toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                log.warn("Liveness thread for group {} still running after {}", group.groupId(), drainTimeout);
            }
        }

        if (!workerPool.awaitIdle(remainingUntil(drainDeadline))) {
            log.warn("{} record(s) still in flight for group {} after {}; a handler is not honouring cancellation",
                    workerPool.inUse(), group.groupId(), drainTimeout);
        }

        try {
            group.close();
        } catch (RuntimeException e) {
            log.error("Failed to close consumer group {}: {}", group.groupId(), e.getMessage(), e);
        }
        workerPool.shutdown(remainingUntil(drainDeadline));
        state.set(ConsumerState.CLOSED);
        log.info("Consumer for group {} closed", group.groupId());
    }

    public ConsumerState state() {
        return state.get();
    }

    public boolean isRunning() {
        ConsumerState current = state.get();
        return current == ConsumerState.JOINING || current == ConsumerState.CLAIMED;
    }

    ShutdownSignal signal() {
        return signal;
    }

    private void runLivenessLoop() {
        SessionHandler sessionHandler = new DispatchingSessionHandler();
        while (!signal.isCancelled()) {
            transition(ConsumerState.JOINING);
            try {
                group.consume(signal, sessionHandler);
                if (!signal.isCancelled()) {
                    log.warn("Consumer group {} returned without shutdown, rejoining in {} ms",
                            group.groupId(), rejoinInterval.toMillis());
                    signal.await(rejoinInterval);
                }
            } catch (CancellationException e) {
                break;
            } catch (RuntimeException e) {
                if (signal.isCancelled()) {
                    break;
                }
                metrics.recordJoinFailure();
                log.error("Error from consumer group {}, rejoining in {} ms: {}",
                        group.groupId(), rejoinInterval.toMillis(), e.getMessage(), e);
                signal.await(rejoinInterval);
            }
        }
        log.debug("Liveness loop for group {} exited", group.groupId());
    }

    private void transition(ConsumerState next) {
        state.updateAndGet(current ->
                current == ConsumerState.DRAINING || current == ConsumerState.CLOSED ? current : next);
    }

    private void dispatchClaim(ConsumerSession session, PartitionClaim claim) {
        log.info("Consuming {} (group {}, generation {})", claim.partition(), session.groupId(), session.generation());
        ShutdownSignal sessionSignal = session.signal();
        while (claim.isOpen() && !sessionSignal.isCancelled()) {
            Optional<LogRecord> next = claim.poll(pollTimeout);
            if (next.isEmpty()) {
                continue;
            }
            LogRecord record = next.get();
            metrics.recordReceived(record.valueSize());

            WorkerSlot slot;
            try {
                slot = workerPool.acquire(sessionSignal);
            } catch (CancellationException e) {
                log.debug("Session ended while waiting for a worker slot; {} left uncommitted", record);
                break;
            }

            try {
                workerPool.execute(slot, () -> process(session, record));
            } catch (RejectedExecutionException e) {
                log.warn("Worker pool rejected {}; left uncommitted: {}", record, e.getMessage());
                break;
            }
        }
        log.info("Stopped consuming {} (group {}, generation {})", claim.partition(), session.groupId(), session.generation());
    }

    private void process(ConsumerSession session, LogRecord record) {
        RetryState retry = RetryState.start(handlerRetry, retrySettings.getDeadline(), clock);
        try {
            while (true) {
                signal.throwIfCancelled();
                retry.beginAttempt();
                if (retry.attempts() > 1) {
                    metrics.recordRetry();
                }

                ProcessingOutcome outcome = invoke(record);

                if (outcome.isSuccess()) {
                    retry.recordSuccess();
                    session.commit(record);
                    metrics.recordOutcome("success", retry.elapsed());
                    log.debug("Processed {} in {} attempt(s)", record, retry.attempts());
                    return;
                }

                if (outcome.isTerminal()) {
                    log.warn("Terminal failure for {}, routing to dead-letter: {}", record, describe(outcome.getCause()));
                    if (deadLetter(record, "terminal")) {
                        session.commit(record);
                        metrics.recordOutcome("dead_letter", retry.elapsed());
                    }
                    return;
                }

                Optional<Duration> backoff = retry.recordFailure(failureOf(outcome));
                if (backoff.isEmpty()) {
                    log.error("Failed to process {} after {} attempt(s) in {} ms: {}",
                            record, retry.attempts(), retry.elapsed().toMillis(), describe(outcome.getCause()));
                    if (deadLetter(record, "exhausted")) {
                        session.commit(record);
                        metrics.recordOutcome("dead_letter", retry.elapsed());
                    }
                    return;
                }

                Duration delay = backoff.get();
                log.warn("Retrying {} after {} ms (attempt {}/{}): {}",
                        record, delay.toMillis(), retry.attempts(), retry.maxAttempts(), describe(outcome.getCause()));
                if (signal.await(delay)) {
                    throw new CancellationException("Shutdown during backoff");
                }
            }
        } catch (CancellationException e) {
            metrics.recordOutcome("abandoned", retry.elapsed());
            log.info("Abandoned {} after {} attempt(s) on shutdown; it will be redelivered", record, retry.attempts());
        }
    }

    private ProcessingOutcome invoke(LogRecord record) {
        try {
            ProcessingOutcome outcome = handler.handle(record, signal);
            if (outcome == null) {
                return ProcessingOutcome.retryable(new IllegalStateException("Handler returned no outcome"));
            }
            return outcome;
        } catch (CancellationException e) {
            throw e;
        } catch (TerminalHandlerException e) {
            return ProcessingOutcome.terminal(e);
        } catch (RuntimeException e) {
            return ProcessingOutcome.retryable(e);
        }
    }

    /**
     * Best-effort dead-letter publish of the original key and value.
     *
     * @return true when the record should be committed: the dead-letter publish succeeded or
     * failed for a reason other than shutdown
     */
    private boolean deadLetter(LogRecord record, String reason) {
        try {
            deadLetterPublisher.publish(signal, record.key(), record.value());
            metrics.recordDeadLetter(reason);
            log.warn("Sent {} to dead-letter topic {} ({})", record, deadLetterPublisher.topic(), reason);
            return true;
        } catch (CancellationException e) {
            metrics.recordDeadLetterFailure();
            log.warn("Dead-letter publish of {} interrupted by shutdown; leaving it uncommitted", record);
            return false;
        } catch (RuntimeException e) {
            metrics.recordDeadLetterFailure();
            log.error("Failed to send {} to dead-letter topic {}: {}", record, deadLetterPublisher.topic(), e.getMessage(), e);
            return true;
        }
    }

    private static Duration remainingUntil(long deadlineNanos) {
        return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    }

    private static Throwable failureOf(ProcessingOutcome outcome) {
        return outcome.getCause() != null ? outcome.getCause() : new IllegalStateException("Retryable outcome without a cause");
    }

    private static String describe(Throwable cause) {
        return cause == null ? "unknown cause" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    private final class DispatchingSessionHandler implements SessionHandler {

        @Override
        public void onSessionStart(ConsumerSession session) {
            transition(ConsumerState.CLAIMED);
            log.info("Session generation {} started for group {} with {} claim(s)",
                    session.generation(), session.groupId(), session.claims().size());
        }

        @Override
        public void consumeClaim(ConsumerSession session, PartitionClaim claim) {
            dispatchClaim(session, claim);
        }

        @Override
        public void onSessionEnd(ConsumerSession session) {
            transition(ConsumerState.JOINING);
            log.info("Session generation {} ended for group {}", session.generation(), session.groupId());
        }
    }
}
