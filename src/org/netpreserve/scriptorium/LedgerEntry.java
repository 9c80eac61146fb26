package org.netpreserve.scriptorium;

import java.time.Instant;

/**
 * An immutable row of the provenance ledger.
 */
public sealed interface LedgerEntry permits FetchAttempt, ArchivedRecord {
    String identifier();

    Instant date();
}
