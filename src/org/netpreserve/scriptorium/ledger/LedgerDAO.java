package org.netpreserve.scriptorium.ledger;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;

import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(LedgerRow.class)
public interface LedgerDAO {
    @SqlQuery("""
            INSERT INTO ledger (run_id, kind, position, identifier, url, host, date, outcome, status, error,
                                elapsed_ms, retries, checksum, size, path, pages, text_chars, text_words, text_pages)
            VALUES (:runId, :kind, :position, :identifier, :url, :host, :date, :outcome, :status, :error,
                    :elapsedMs, :retries, :checksum, :size, :path, :pages, :textChars, :textWords, :textPages)
            RETURNING seq""")
    long insert(@BindMethods LedgerRow row);

    @SqlQuery("""
            SELECT * FROM ledger
            WHERE identifier = :identifier AND kind = 'ARCHIVED'
            ORDER BY seq DESC
            LIMIT 1""")
    Optional<LedgerRow> findActive(String identifier);

    @SqlQuery("SELECT COUNT(*) > 0 FROM ledger WHERE identifier = :identifier AND kind = 'ARCHIVED'")
    boolean hasArchived(String identifier);

    @SqlQuery("SELECT * FROM ledger ORDER BY run_id, position IS NULL, position, seq")
    List<LedgerRow> listInRunOrder();
}
