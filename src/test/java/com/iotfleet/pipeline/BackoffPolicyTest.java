package com.iotfleet.pipeline;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    @Test
    void delay_staysWithinJitterBounds() {
        Random random = new Random(42);
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(100), 0.2, random::nextDouble);

        for (int i = 0; i < 1_000; i++) {
            long first = policy.delay(0).toMillis();
            long third = policy.delay(2).toMillis();
            assertTrue(first >= 80 && first <= 120, "attempt 0 delay " + first);
            assertTrue(third >= 320 && third <= 480, "attempt 2 delay " + third);
        }
    }

    @Test
    void delay_atExtremesOfRandom() {
        BackoffPolicy low = new BackoffPolicy(Duration.ofMillis(100), 0.2, () -> 0.0);
        BackoffPolicy high = new BackoffPolicy(Duration.ofMillis(100), 0.2, () -> 0.999999);

        assertEquals(Duration.ofMillis(80), low.delay(0));
        assertEquals(Duration.ofMillis(320), low.delay(2));
        assertEquals(119, high.delay(0).toMillis());
        assertEquals(479, high.delay(2).toMillis());
    }

    @Test
    void delay_withoutJitterDoublesEachAttempt() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(50), 0.0);

        assertEquals(Duration.ofMillis(50), policy.delay(0));
        assertEquals(Duration.ofMillis(100), policy.delay(1));
        assertEquals(Duration.ofMillis(200), policy.delay(2));
        assertEquals(Duration.ofMillis(400), policy.delay(3));
    }

    @Test
    void bounds_matchJitterFactor() {
        BackoffPolicy policy = BackoffPolicy.defaults();

        assertEquals(Duration.ofMillis(80), policy.minDelay(0));
        assertEquals(Duration.ofMillis(120), policy.maxDelay(0));
        assertEquals(Duration.ofMillis(320), policy.minDelay(2));
        assertEquals(Duration.ofMillis(480), policy.maxDelay(2));
    }

    @Test
    void apply_usesOneBasedAttemptCount() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(100), 0.0);

        assertEquals(100L, policy.apply(1));
        assertEquals(200L, policy.apply(2));
    }

    @Test
    void constructor_rejectsInvalidJitter() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(Duration.ofMillis(100), 1.0));
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(Duration.ofMillis(100), -0.1));
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(Duration.ofMillis(-1), 0.2));
    }

    @Test
    void delay_rejectsNegativeAttempt() {
        assertThrows(IllegalArgumentException.class, () -> BackoffPolicy.defaults().delay(-1));
    }
}
