package org.netpreserve.scriptorium;

import org.junit.jupiter.api.Test;
import org.netpreserve.scriptorium.config.BackoffConfig;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BackoffTest {
    @Test
    public void growsExponentiallyUpToTheCap() {
        var backoff = new Backoff(new BackoffConfig(Duration.ofSeconds(2), Duration.ofSeconds(60), 2.0,
                Duration.ZERO));
        assertEquals(Duration.ofSeconds(2), backoff.delay(1));
        assertEquals(Duration.ofSeconds(4), backoff.delay(2));
        assertEquals(Duration.ofSeconds(8), backoff.delay(3));
        assertEquals(Duration.ofSeconds(32), backoff.delay(5));
        assertEquals(Duration.ofSeconds(60), backoff.delay(6));
        assertEquals(Duration.ofSeconds(60), backoff.delay(50));
    }

    @Test
    public void jitterStaysWithinBounds() {
        var backoff = new Backoff(new BackoffConfig(Duration.ofMillis(100), Duration.ofMillis(1000), 2.0,
                Duration.ofMillis(50)), new Random(42));
        for (int retry = 1; retry <= 10; retry++) {
            long base = Math.min(100L << (retry - 1), 1000);
            long delay = backoff.delay(retry).toMillis();
            assertTrue(delay >= base && delay < base + 50, "retry " + retry + " delay " + delay);
        }
    }

    @Test
    public void retriesCountFromOne() {
        var backoff = new Backoff(new BackoffConfig(Duration.ofMillis(1), Duration.ofMillis(1), 1.0, null));
        assertThrows(IllegalArgumentException.class, () -> backoff.delay(0));
    }
}
