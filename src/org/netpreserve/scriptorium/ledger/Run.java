package org.netpreserve.scriptorium.ledger;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * One invocation of the archiver. {@code finished} stays null when the process died before the run ended.
 */
public record Run(
        long id,
        Instant started,
        @Nullable Instant finished,
        boolean forced,
        int candidates,
        int attempted,
        int succeeded,
        int skipped,
        int rejected,
        int failed,
        int cancelled) {
}
