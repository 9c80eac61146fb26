package org.netpreserve.scriptorium.ledger;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.netpreserve.scriptorium.RunSummary;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(Run.class)
public interface RunDAO {
    @SqlQuery("INSERT INTO runs (started, forced) VALUES (:started, :forced) RETURNING id")
    long start(Instant started, boolean forced);

    @SqlUpdate("""
            UPDATE runs
            SET finished = :finished,
                candidates = :s.candidates,
                attempted = :s.attempted,
                succeeded = :s.succeeded,
                skipped = :s.skipped,
                rejected = :s.rejected,
                failed = :s.failed,
                cancelled = :s.cancelled
            WHERE id = :id""")
    void finish(long id, Instant finished, @BindMethods("s") RunSummary summary);

    @SqlQuery("SELECT * FROM runs WHERE id = :id")
    Run find(long id);

    @SqlQuery("SELECT * FROM runs ORDER BY id")
    List<Run> list();
}
