package org.netpreserve.scriptorium.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.scriptorium.util.jackson.DurationDeserializer;

import java.time.Duration;

/**
 * @param base       delay before the first retry
 * @param max        upper bound on any single delay
 * @param multiplier growth factor per retry
 * @param jitter     random extra delay in [0, jitter)
 */
public record BackoffConfig(
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration base,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration max,
        double multiplier,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration jitter) {
}
