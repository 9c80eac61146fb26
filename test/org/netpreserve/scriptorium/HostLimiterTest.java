package org.netpreserve.scriptorium;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class HostLimiterTest {
    @Test
    public void onePermitPerHost() throws Exception {
        var limiter = new HostLimiter(Duration.ZERO);
        var acquired = new AtomicBoolean();
        var started = new CountDownLatch(1);
        Thread waiter;
        try (var permit = limiter.acquire("a.example")) {
            waiter = new Thread(() -> {
                started.countDown();
                try (var second = limiter.acquire("a.example")) {
                    acquired.set(true);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            waiter.start();
            assertTrue(started.await(5, TimeUnit.SECONDS));
            Thread.sleep(100);
            assertFalse(acquired.get(), "second request to the same host must wait");

            // other hosts are unaffected
            try (var other = limiter.acquire("b.example")) {
                assertEquals(2, limiter.busyHosts());
            }
        }
        waiter.join(5000);
        assertTrue(acquired.get());
        assertEquals(0, limiter.busyHosts());
    }

    @Test
    public void politenessDelayBetweenRequests() throws Exception {
        var limiter = new HostLimiter(Duration.ofMillis(200));
        limiter.acquire("a.example").close();
        long start = System.nanoTime();
        limiter.acquire("a.example").close();
        long waitedMs = (System.nanoTime() - start) / 1_000_000;
        assertTrue(waitedMs >= 150, "waited only " + waitedMs + "ms");
    }

    @Test
    public void interruptedWaiterLeavesThePermitAlone() throws Exception {
        var limiter = new HostLimiter(Duration.ZERO);
        var interrupted = new AtomicBoolean();
        try (var permit = limiter.acquire("a.example")) {
            Thread waiter = new Thread(() -> {
                try (var second = limiter.acquire("a.example")) {
                    fail("should not get the permit");
                } catch (InterruptedException e) {
                    interrupted.set(true);
                }
            });
            waiter.start();
            Thread.sleep(50);
            waiter.interrupt();
            waiter.join(5000);
            assertTrue(interrupted.get());
            assertEquals(1, limiter.busyHosts());
        }
        assertEquals(0, limiter.busyHosts());
    }

    @Test
    public void closingTwiceReleasesOnce() throws Exception {
        var limiter = new HostLimiter(Duration.ZERO);
        var permit = limiter.acquire("a.example");
        permit.close();
        permit.close();
        try (var again = limiter.acquire("a.example")) {
            assertEquals(1, limiter.busyHosts());
        }
    }
}
