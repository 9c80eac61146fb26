package org.netpreserve.scriptorium.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.scriptorium.util.jackson.DurationDeserializer;

import java.time.Duration;

/**
 * How candidates are fetched.
 *
 * @param workers       number of concurrent workers
 * @param timeout       bound on a single request, connect to last body byte
 * @param retries       retries per URL after the first request, transient failures only
 * @param backoff       delay curve between retries
 * @param delay         minimum gap between two requests to the same host
 * @param maxRedirects  redirect hops followed per request
 * @param userAgent     User-Agent string to identify as to servers
 * @param runTimeout    cancel the whole run after this long (null for no limit)
 * @param maxCandidates only process the first N candidates of the source (0 for all)
 */
public record FetchConfig(
        int workers,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration timeout,
        int retries,
        BackoffConfig backoff,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration delay,
        int maxRedirects,
        String userAgent,
        @JsonDeserialize(using = DurationDeserializer.class)
        @Nullable Duration runTimeout,
        int maxCandidates) {
}
