package com.iotfleet.pipeline;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ShutdownSignalTest {

    @Test
    void cancel_isIdempotentAndRunsListenersOnce() {
        ShutdownSignal signal = new ShutdownSignal("test");
        AtomicInteger calls = new AtomicInteger();
        signal.register(calls::incrementAndGet);

        assertTrue(signal.cancel());
        assertFalse(signal.cancel());

        assertTrue(signal.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    void register_afterCancelRunsImmediately() {
        ShutdownSignal signal = new ShutdownSignal("test");
        signal.cancel();
        AtomicInteger calls = new AtomicInteger();

        signal.register(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void register_racingCancelRunsListenerOnce() throws Exception {
        for (int i = 0; i < 500; i++) {
            ShutdownSignal signal = new ShutdownSignal("race-" + i);
            AtomicInteger calls = new AtomicInteger();
            CountDownLatch go = new CountDownLatch(1);
            Thread canceller = new Thread(() -> {
                try {
                    go.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                signal.cancel();
            });
            canceller.start();

            go.countDown();
            signal.register(calls::incrementAndGet);
            canceller.join(5_000);

            assertEquals(1, calls.get(), "listener runs on iteration " + i);
        }
    }

    @Test
    void closedRegistration_isNotCalled() {
        ShutdownSignal signal = new ShutdownSignal("test");
        AtomicInteger calls = new AtomicInteger();
        ShutdownSignal.Registration registration = signal.register(calls::incrementAndGet);

        registration.close();
        signal.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    void failingListener_doesNotStopOthers() {
        ShutdownSignal signal = new ShutdownSignal("test");
        AtomicInteger calls = new AtomicInteger();
        signal.register(() -> {
            throw new IllegalStateException("boom");
        });
        signal.register(calls::incrementAndGet);

        signal.cancel();

        assertEquals(1, calls.get());
    }

    @Test
    void await_returnsFalseWhenTimeoutElapses() {
        ShutdownSignal signal = new ShutdownSignal("test");

        assertFalse(signal.await(Duration.ofMillis(20)));
    }

    @Test
    void await_wakesPromptlyOnCancel() {
        ShutdownSignal signal = new ShutdownSignal("test");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(signal::cancel, 50, TimeUnit.MILLISECONDS);
            long start = System.nanoTime();

            assertTrue(signal.await(Duration.ofSeconds(30)));

            assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(5)) < 0);
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void throwIfCancelled_throwsOnlyAfterCancel() {
        ShutdownSignal signal = new ShutdownSignal("test");
        assertDoesNotThrow(signal::throwIfCancelled);

        signal.cancel();

        assertThrows(CancellationException.class, signal::throwIfCancelled);
    }

    @Test
    void awaitCompletion_returnsValue() throws Exception {
        ShutdownSignal signal = new ShutdownSignal("test");

        assertEquals("ack", signal.awaitCompletion(CompletableFuture.completedFuture("ack"), Duration.ofSeconds(1)));
    }

    @Test
    void awaitCompletion_surfacesFailure() {
        ShutdownSignal signal = new ShutdownSignal("test");
        CompletableFuture<String> failed = CompletableFuture.failedFuture(new IllegalStateException("nack"));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> signal.awaitCompletion(failed, Duration.ofSeconds(1)));
        assertEquals("nack", e.getCause().getMessage());
    }

    @Test
    void awaitCompletion_timesOut() {
        ShutdownSignal signal = new ShutdownSignal("test");

        assertThrows(TimeoutException.class,
                () -> signal.awaitCompletion(new CompletableFuture<>(), Duration.ofMillis(20)));
    }

    @Test
    void awaitCompletion_cancelledWhileWaiting() {
        ShutdownSignal signal = new ShutdownSignal("test");
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(signal::cancel, 50, TimeUnit.MILLISECONDS);

            assertThrows(CancellationException.class,
                    () -> signal.awaitCompletion(new CompletableFuture<>(), Duration.ofSeconds(30)));
        } finally {
            scheduler.shutdownNow();
        }
    }
}
