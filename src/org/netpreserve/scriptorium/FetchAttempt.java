package org.netpreserve.scriptorium;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.scriptorium.util.Url;

import java.time.Instant;

/**
 * The finalized outcome of trying one URL for one candidate.
 *
 * @param url       the URL hint tried (null when the candidate had none)
 * @param status    last HTTP status received, if any
 * @param error     error class for anything other than success
 * @param elapsedMs wall time from first request to termination, including backoff
 * @param retries   retries consumed, not counting the first request
 * @param checksum  SHA-256 of the last payload received, if any
 * @param size      byte size of the last payload received, if any
 */
public record FetchAttempt(
        @NotNull String identifier,
        @Nullable Url url,
        @Nullable String host,
        @NotNull Instant date,
        @NotNull Outcome outcome,
        @Nullable Integer status,
        @Nullable String error,
        long elapsedMs,
        int retries,
        @Nullable String checksum,
        @Nullable Long size) implements LedgerEntry {

    public static FetchAttempt rejected(String identifier, @Nullable Url url, @Nullable String host, String reason) {
        return new FetchAttempt(identifier, url, host, Instant.now(), Outcome.REJECTED, null, reason, 0, 0,
                null, null);
    }

    public static FetchAttempt skipped(ArchivedRecord active) {
        return new FetchAttempt(active.identifier(), active.url(), active.host(), Instant.now(), Outcome.SKIPPED,
                null, "already-archived", 0, 0, active.checksum(), active.size());
    }

    public static FetchAttempt cancelled(String identifier, @Nullable Url url, @Nullable String host) {
        return new FetchAttempt(identifier, url, host, Instant.now(), Outcome.CANCELLED, null, "cancelled", 0, 0,
                null, null);
    }
}
