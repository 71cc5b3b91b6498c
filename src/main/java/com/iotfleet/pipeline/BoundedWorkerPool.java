package com.iotfleet.pipeline;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed pool of N worker threads with a slot limiter in front of it.
 *
 * Dispatchers {@link #acquire} a slot (blocking while N are out), then hand the slot and a
 * task to {@link #execute}; the slot is released when the task ends, whatever the path.
 * Because a task is only submitted while holding a slot, the executor queue never holds more
 * than N tasks and at most N handlers run at once.
 *
 * Waiting acquirers are woken by slot release or by cancellation of their signal.
 */
@Slf4j
public class BoundedWorkerPool {

    public static final int DEFAULT_CAPACITY = 10;

    private final String name;
    private final int capacity;
    private final ExecutorService executor;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition slotFreed = lock.newCondition();
    private int inUse;
    private int peakInUse;

    public BoundedWorkerPool(String name, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Worker pool capacity must be >= 1: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.executor = Executors.newFixedThreadPool(capacity, namedThreads(name));
    }

    /**
     * Block until a slot is free.
     *
     * @throws CancellationException if the signal is cancelled before a slot frees up
     */
    public WorkerSlot acquire(ShutdownSignal signal) {
        try (ShutdownSignal.Registration ignored = signal.register(this::wakeWaiters)) {
            lock.lock();
            try {
                while (inUse >= capacity) {
                    signal.throwIfCancelled();
                    slotFreed.await();
                }
                signal.throwIfCancelled();
                inUse++;
                peakInUse = Math.max(peakInUse, inUse);
                return new WorkerSlot(this);
            } finally {
                lock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for a worker slot in " + name);
        }
    }

    /**
     * Run the task on a worker thread and release the slot when it ends. If the task cannot be
     * scheduled the slot is released at once and the rejection propagates.
     */
    public void execute(WorkerSlot slot, Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Worker task failed in pool {}: {}", name, e.getMessage(), e);
                } finally {
                    slot.release();
                }
            });
        } catch (RejectedExecutionException e) {
            slot.release();
            throw e;
        }
    }

    /**
     * Wait until every slot has been returned.
     *
     * @return false if slots were still out when the timeout elapsed
     */
    public boolean awaitIdle(Duration timeout) {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (inUse > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = slotFreed.awaitNanos(remaining);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return inUse == 0;
        } finally {
            lock.unlock();
        }
    }

    /** Stop the worker threads, interrupting any still running once the timeout elapses. */
    public void shutdown(Duration timeout) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker pool {} did not terminate within {}; interrupting workers", name, timeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    void returnSlot() {
        lock.lock();
        try {
            if (inUse == 0) {
                throw new IllegalStateException("Worker pool " + name + " released more slots than acquired");
            }
            inUse--;
            slotFreed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void wakeWaiters() {
        lock.lock();
        try {
            slotFreed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public int inUse() {
        lock.lock();
        try {
            return inUse;
        } finally {
            lock.unlock();
        }
    }

    public int peakInUse() {
        lock.lock();
        try {
            return peakInUse;
        } finally {
            lock.unlock();
        }
    }

    public String name() {
        return name;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
