package com.iotfleet.pipeline;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BoundedWorkerPoolTest {

    private BoundedWorkerPool pool;

    @BeforeEach
    void setUp() {
        pool = new BoundedWorkerPool("test-worker", 2);
    }

    @AfterEach
    void tearDown() {
        pool.shutdown(Duration.ofSeconds(1));
    }

    @Test
    void inFlightTasks_neverExceedCapacity() throws Exception {
        ShutdownSignal signal = new ShutdownSignal("test");
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(10);

        for (int i = 0; i < 10; i++) {
            WorkerSlot slot = pool.acquire(signal);
            pool.execute(slot, () -> {
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                sleep(20);
                running.decrementAndGet();
                done.countDown();
            });
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertTrue(pool.awaitIdle(Duration.ofSeconds(1)));
        assertTrue(maxRunning.get() <= 2);
        assertTrue(pool.peakInUse() <= 2);
        assertEquals(0, pool.inUse());
    }

    @Test
    void acquire_wakesOnCancellation() throws Exception {
        ShutdownSignal signal = new ShutdownSignal("test");
        pool.acquire(signal);
        pool.acquire(signal);

        CompletableFuture<WorkerSlot> waiter = CompletableFuture.supplyAsync(() -> pool.acquire(signal));
        Thread.sleep(50);
        assertFalse(waiter.isDone());

        signal.cancel();

        Exception e = assertThrows(Exception.class, () -> waiter.get(5, TimeUnit.SECONDS));
        assertInstanceOf(CancellationException.class, e.getCause());
        assertEquals(2, pool.inUse());
    }

    @Test
    void acquire_failsFastWhenAlreadyCancelled() {
        ShutdownSignal signal = new ShutdownSignal("test");
        signal.cancel();

        assertThrows(CancellationException.class, () -> pool.acquire(signal));
        assertEquals(0, pool.inUse());
    }

    @Test
    void release_isIdempotent() {
        WorkerSlot slot = pool.acquire(new ShutdownSignal("test"));

        assertTrue(slot.release());
        assertFalse(slot.release());

        assertTrue(slot.isReleased());
        assertEquals(0, pool.inUse());
    }

    @Test
    void execute_releasesSlotWhenTaskThrows() {
        WorkerSlot slot = pool.acquire(new ShutdownSignal("test"));

        pool.execute(slot, () -> {
            throw new IllegalStateException("handler bug");
        });

        assertTrue(pool.awaitIdle(Duration.ofSeconds(5)));
        assertTrue(slot.isReleased());
    }

    @Test
    void awaitIdle_timesOutWhileSlotHeld() {
        pool.acquire(new ShutdownSignal("test"));

        assertFalse(pool.awaitIdle(Duration.ofMillis(20)));
    }

    @Test
    void constructor_rejectsZeroCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedWorkerPool("bad", 0));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
