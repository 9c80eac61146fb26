package org.netpreserve.scriptorium;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Allows at most one in-flight request per host and spaces consecutive requests to the same host by a fixed
 * delay.
 */
public class HostLimiter {
    private static final Logger log = LoggerFactory.getLogger(HostLimiter.class);
    private final Map<String, Slot> slots = new ConcurrentHashMap<>();
    private final long delayNanos;

    public HostLimiter(Duration delay) {
        this.delayNanos = delay.toNanos();
    }

    /**
     * Blocks until the host is free and its politeness delay has passed. Use in try-with-resources.
     */
    public Permit acquire(String host) throws InterruptedException {
        Slot slot = slots.computeIfAbsent(host, h -> new Slot());
        slot.semaphore.acquire();
        try {
            long wait = slot.nextAllowed - System.nanoTime();
            if (wait > 0) {
                log.trace("Waiting {}ms before next request to {}", wait / 1_000_000, host);
                TimeUnit.NANOSECONDS.sleep(wait);
            }
        } catch (InterruptedException e) {
            slot.semaphore.release();
            throw e;
        }
        return new Permit(host, slot);
    }

    /**
     * Number of hosts with a request in flight.
     */
    public int busyHosts() {
        return (int) slots.values().stream().filter(slot -> slot.semaphore.availablePermits() == 0).count();
    }

    private static class Slot {
        final Semaphore semaphore = new Semaphore(1, true);
        volatile long nextAllowed = System.nanoTime();
    }

    public class Permit implements AutoCloseable {
        private final String host;
        private final Slot slot;
        private boolean released;

        private Permit(String host, Slot slot) {
            this.host = host;
            this.slot = slot;
        }

        public String host() {
            return host;
        }

        @Override
        public void close() {
            if (released) return;
            released = true;
            slot.nextAllowed = System.nanoTime() + delayNanos;
            slot.semaphore.release();
        }
    }
}
