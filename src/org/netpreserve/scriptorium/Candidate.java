package org.netpreserve.scriptorium;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.scriptorium.util.Url;

import java.util.List;

/**
 * One bibliographic item to archive.
 *
 * @param identifier opaque bibliographic key (e.g. an ADS bibcode), unique within a run
 * @param urls       URL hints in order of preference
 */
public record Candidate(
        @NotNull String identifier,
        @NotNull String title,
        int year,
        @Nullable String doi,
        @NotNull List<Url> urls) {
    public Candidate {
        urls = List.copyOf(urls);
    }

    public Candidate withUrls(List<Url> urls) {
        return new Candidate(identifier, title, year, doi, urls);
    }
}
