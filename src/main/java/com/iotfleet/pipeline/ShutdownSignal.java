package com.iotfleet.pipeline;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by every blocking point of the pipeline.
 *
 * Blocking Points:
 * - Worker slot acquisition (woken through a registered listener)
 * - Backoff waits between attempts ({@link #await(Duration)})
 * - Publish acknowledgment waits ({@link #awaitCompletion(CompletableFuture, Duration)})
 *
 * Cancellation is one-way and idempotent. Waiters are woken by the cancellation itself,
 * never by polling.
 */
@Slf4j
public final class ShutdownSignal {

    private final String name;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public ShutdownSignal(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    /**
     * Cancel the signal and wake every waiter.
     *
     * @return true if this call performed the cancellation
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        log.debug("Shutdown signal {} cancelled", name);
        latch.countDown();
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation listener failed on signal {}: {}", name, e.getMessage(), e);
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Shutdown signal " + name + " cancelled");
        }
    }

    /**
     * Wait for the given duration or until cancelled, whichever is first.
     *
     * @return true if the signal was cancelled (the wait was cut short)
     */
    public boolean await(Duration timeout) {
        if (timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        try {
            return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    /**
     * Wait for a future to complete, bounded by a timeout and by this signal.
     *
     * @throws CancellationException if the signal is cancelled first or the thread is interrupted
     * @throws ExecutionException    if the future completed exceptionally
     * @throws TimeoutException      if the timeout elapsed first
     */
    public <T> T awaitCompletion(CompletableFuture<T> future, Duration timeout)
            throws ExecutionException, TimeoutException {
        CompletableFuture<T> guarded = new CompletableFuture<>();
        future.whenComplete((value, error) -> {
            if (error != null) {
                guarded.completeExceptionally(error);
            } else {
                guarded.complete(value);
            }
        });
        try (Registration ignored = register(() -> guarded.completeExceptionally(
                new CancellationException("Shutdown signal " + name + " cancelled")))) {
            return guarded.get(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting on signal " + name);
        }
    }

    /**
     * Register a listener run once on cancellation. If already cancelled the listener runs
     * immediately on the calling thread. Close the registration to remove the listener.
     */
    public Registration register(Runnable listener) {
        AtomicBoolean ran = new AtomicBoolean(false);
        Runnable once = () -> {
            if (ran.compareAndSet(false, true)) {
                listener.run();
            }
        };
        listeners.add(once);
        if (isCancelled()) {
            once.run();
        }
        return () -> listeners.remove(once);
    }

    /** Handle removing a cancellation listener. */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    @Override
    public String toString() {
        return "ShutdownSignal[" + name + (isCancelled() ? ", cancelled]" : "]");
    }
}
