package org.netpreserve.scriptorium.ledger;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.scriptorium.*;
import org.netpreserve.scriptorium.util.Url;

import java.time.Instant;

/**
 * Flat form of a {@link LedgerEntry} as stored in the {@code ledger} table and exported.
 *
 * @param seq      total order of writes, assigned by the database
 * @param position the candidate's position in the run's source, null when unknown
 */
public record LedgerRow(
        long seq,
        long runId,
        Kind kind,
        @Nullable Integer position,
        String identifier,
        @Nullable Url url,
        @Nullable String host,
        Instant date,
        Outcome outcome,
        @Nullable Integer status,
        @Nullable String error,
        @Nullable Long elapsedMs,
        @Nullable Integer retries,
        @Nullable String checksum,
        @Nullable Long size,
        @Nullable String path,
        @Nullable Integer pages,
        @Nullable Integer textChars,
        @Nullable Integer textWords,
        @Nullable Integer textPages) {

    public enum Kind {
        ATTEMPT, ARCHIVED
    }

    static LedgerRow of(long runId, @Nullable Integer position, LedgerEntry entry) {
        if (entry instanceof FetchAttempt a) {
            return new LedgerRow(0, runId, Kind.ATTEMPT, position, a.identifier(), a.url(), a.host(), a.date(),
                    a.outcome(), a.status(), a.error(), a.elapsedMs(), a.retries(), a.checksum(), a.size(),
                    null, null, null, null, null);
        } else if (entry instanceof ArchivedRecord r) {
            TextStats stats = r.textStats();
            return new LedgerRow(0, runId, Kind.ARCHIVED, position, r.identifier(), r.url(), r.host(), r.date(),
                    Outcome.SUCCESS, null, null, null, null, r.checksum(), r.size(), r.path(), r.pages(),
                    stats == null ? null : stats.chars(),
                    stats == null ? null : stats.words(),
                    stats == null ? null : stats.pagesSampled());
        }
        throw new IllegalArgumentException("Unknown ledger entry " + entry);
    }

    public LedgerEntry toEntry() {
        return switch (kind) {
            case ATTEMPT -> new FetchAttempt(identifier, url, host, date, outcome, status, error,
                    elapsedMs == null ? 0 : elapsedMs, retries == null ? 0 : retries, checksum, size);
            case ARCHIVED -> new ArchivedRecord(identifier, url, path, checksum, size == null ? 0 : size, pages,
                    textChars == null ? null : new TextStats(textChars, textWords == null ? 0 : textWords,
                            textPages == null ? 0 : textPages),
                    host, date);
        };
    }
}
