package org.netpreserve.scriptorium;

import org.netpreserve.scriptorium.config.FetchConfig;

import java.util.function.BooleanSupplier;

/**
 * Collaborators shared by every attempt in a run.
 *
 * @param cancelled polled between attempt states
 */
record FetchContext(
        FetchConfig config,
        Downloader downloader,
        HostLimiter limiter,
        TrustPolicy trust,
        ContentVerifier verifier,
        Storage storage,
        Backoff backoff,
        BooleanSupplier cancelled) {
}
