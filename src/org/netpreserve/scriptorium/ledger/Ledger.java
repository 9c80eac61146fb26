package org.netpreserve.scriptorium.ledger;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.scriptorium.ArchivedRecord;
import org.netpreserve.scriptorium.LedgerEntry;
import org.netpreserve.scriptorium.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only provenance ledger. Entries are written one statement at a time and are durable once
 * {@link #record} returns. Writes happen on a single thread, the orchestrator's; the monitor here only keeps
 * the run id consistent with the rows written under it.
 */
public class Ledger implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Ledger.class);
    public static final String FILENAME = "ledger.sqlite3";
    private final Database db;
    private @Nullable Long runId;

    public Ledger(Database db) {
        this.db = db;
    }

    public static Ledger open(Path dataDir) {
        return new Ledger(Database.open(dataDir.resolve(FILENAME)));
    }

    public synchronized long startRun(boolean force) {
        if (runId != null) throw new IllegalStateException("Run " + runId + " is still open");
        runId = db.runs().start(Instant.now(), force);
        log.info("Started run {}{}", runId, force ? " (forced)" : "");
        return runId;
    }

    public synchronized void finishRun(RunSummary summary) {
        long id = currentRun();
        db.runs().finish(id, Instant.now(), summary);
        runId = null;
        log.info("Finished run {}: {}", id, summary);
    }

    public long record(LedgerEntry entry) {
        return record(entry, null);
    }

    /**
     * Appends an entry to the current run.
     *
     * @param position the candidate's position in the source, used to order exports
     * @return the entry's sequence number
     */
    public synchronized long record(LedgerEntry entry, @Nullable Integer position) {
        long seq = db.ledger().insert(LedgerRow.of(currentRun(), position, entry));
        log.atDebug().addKeyValue("seq", seq).addKeyValue("id", entry.identifier()).log("Recorded {}",
                entry.getClass().getSimpleName());
        return seq;
    }

    public boolean hasActiveRecord(String identifier) {
        return db.ledger().hasArchived(identifier);
    }

    /**
     * The most recent archived record for the identifier. Older ones are superseded, never changed.
     */
    public Optional<ArchivedRecord> activeRecord(String identifier) {
        return db.ledger().findActive(identifier).map(row -> (ArchivedRecord) row.toEntry());
    }

    /**
     * All entries ordered by run, then candidate position, then sequence.
     */
    public List<LedgerRow> entries() {
        return db.ledger().listInRunOrder();
    }

    public List<Run> runs() {
        return db.runs().list();
    }

    private long currentRun() {
        if (runId == null) throw new IllegalStateException("No run started");
        return runId;
    }

    @Override
    public void close() {
        db.close();
    }
}
