package org.netpreserve.scriptorium;

import org.netpreserve.scriptorium.util.Url;

import java.time.Duration;

/**
 * Performs one GET request. Implementations must not follow redirects and must give up once {@code timeout}
 * elapses.
 */
public interface Downloader extends AutoCloseable {
    /**
     * @return the response, whatever its status
     * @throws FetchException       when no response was received
     * @throws InterruptedException when the calling thread was interrupted while waiting
     */
    Download fetch(Url url, Duration timeout) throws FetchException, InterruptedException;

    @Override
    default void close() {
    }
}
