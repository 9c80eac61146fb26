package org.netpreserve.scriptorium;

import org.netpreserve.scriptorium.config.BackoffConfig;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Capped exponential backoff with additive jitter.
 */
public class Backoff {
    private final BackoffConfig config;
    private final Random random;

    public Backoff(BackoffConfig config) {
        this(config, null);
    }

    Backoff(BackoffConfig config, Random random) {
        this.config = config;
        this.random = random;
    }

    /**
     * Delay before the given retry (1 for the first retry).
     */
    public Duration delay(int retry) {
        if (retry < 1) throw new IllegalArgumentException("retry must be at least 1");
        double millis = config.base().toMillis() * Math.pow(config.multiplier(), retry - 1);
        long capped = (long) Math.min(millis, config.max().toMillis());
        long jitterMillis = config.jitter() == null ? 0 : config.jitter().toMillis();
        if (jitterMillis > 0) {
            Random r = random != null ? random : ThreadLocalRandom.current();
            capped += (long) (r.nextDouble() * jitterMillis);
        }
        return Duration.ofMillis(capped);
    }

    public Duration max() {
        return config.max();
    }
}
