package org.netpreserve.scriptorium;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.scriptorium.util.Url;

import java.time.Instant;

/**
 * A successfully archived candidate.
 *
 * @param url       final URL the content was received from, after redirects
 * @param path      storage path relative to the data directory
 * @param pages     detected page count, null when unknown
 * @param textStats text statistics, null when unknown
 */
public record ArchivedRecord(
        @NotNull String identifier,
        @NotNull Url url,
        @NotNull String path,
        @NotNull String checksum,
        long size,
        @Nullable Integer pages,
        @Nullable TextStats textStats,
        @NotNull String host,
        @NotNull Instant date) implements LedgerEntry {
}
