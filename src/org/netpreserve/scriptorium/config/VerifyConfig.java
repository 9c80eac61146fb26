package org.netpreserve.scriptorium.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.scriptorium.ContentKind;
import org.netpreserve.scriptorium.util.jackson.ByteSizeDeserializer;

import java.util.List;

/**
 * Content verification settings.
 *
 * @param minSize      smallest acceptable payload
 * @param accept       content kinds that may be archived
 * @param minTextChars below this many extracted characters a document counts as a bare scan
 * @param textPages    how many leading pages text statistics are sampled from
 * @param maxPages     reject documents with more pages than this (null for no limit)
 */
public record VerifyConfig(
        @JsonDeserialize(using = ByteSizeDeserializer.class)
        Long minSize,
        List<ContentKind> accept,
        int minTextChars,
        int textPages,
        @Nullable Integer maxPages) {
}
