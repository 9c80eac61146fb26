package org.netpreserve.scriptorium.ledger;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.argument.ArgumentFactory;
import org.jdbi.v3.core.argument.NullArgument;
import org.jdbi.v3.core.config.JdbiConfig;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.sqlobject.CreateSqlObject;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.jdbi.v3.sqlobject.transaction.Transactional;
import org.netpreserve.scriptorium.util.Url;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Types;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import static org.jdbi.v3.core.generic.GenericTypes.getErasedType;

/**
 * SQLite database holding the provenance ledger. Every statement auto-commits with {@code synchronous = FULL}
 * so an acknowledged write survives a crash.
 */
public interface Database extends AutoCloseable, Transactional<Database> {
    static Database newDatabaseInMemory() {
        return open("jdbc:sqlite::memory:");
    }

    static Database open(Path path) {
        return open("jdbc:sqlite:" + path);
    }

    static Database open(String jdbcUrl) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setConnectionInitSql("PRAGMA synchronous = FULL; PRAGMA foreign_keys = ON; PRAGMA busy_timeout = 60000;");
        // a single connection: the ledger has one writer and an in-memory database lives as long as its connection
        config.setMaximumPoolSize(1);
        config.setPoolName("ledger");
        var dataSource = new HikariDataSource(config);
        var jdbi = Jdbi.create(dataSource);
        jdbi.installPlugin(new SqlObjectPlugin());
        jdbi.registerColumnMapper(Url.class, stringColumnMapper(Url::new));
        jdbi.registerColumnMapper(Instant.class, epochMillisColumnMapper());
        jdbi.registerArgument(stringArgument(Url.class, Url::toString));
        jdbi.registerArgument(epochMillisArgument());
        jdbi.getConfig(DataSourceHolder.class).dataSource = dataSource;
        Database db = jdbi.onDemand(Database.class);
        db.init();
        return db;
    }

    private static <T> ColumnMapper<T> stringColumnMapper(Function<String, T> constructor) {
        return (r, col, ctx) -> {
            String value = r.getString(col);
            return value == null ? null : constructor.apply(value);
        };
    }

    private static <T> ArgumentFactory.Preparable stringArgument(Class<T> clazz, Function<T, String> getter) {
        return (type, config) -> {
            if (!clazz.isAssignableFrom(getErasedType(type))) return Optional.empty();
            return Optional.of(value -> {
                if (value == null) return new NullArgument(Types.VARCHAR);
                return (pos, stmt, ctx) -> stmt.setString(pos, getter.apply(clazz.cast(value)));
            });
        };
    }

    private static ColumnMapper<Instant> epochMillisColumnMapper() {
        return (r, col, ctx) -> {
            long value = r.getLong(col);
            return r.wasNull() ? null : Instant.ofEpochMilli(value);
        };
    }

    private static ArgumentFactory.Preparable epochMillisArgument() {
        return (type, config) -> {
            if (!Instant.class.isAssignableFrom(getErasedType(type))) return Optional.empty();
            return Optional.of(value -> {
                if (value == null) return new NullArgument(Types.BIGINT);
                return (pos, stmt, ctx) -> stmt.setLong(pos, ((Instant) value).toEpochMilli());
            });
        };
    }

    default void init() {
        // we can't use @SqlScript because we need to use executeAsSeparateStatements() on sqlite
        try (var stream = Objects.requireNonNull(Database.class.getResourceAsStream("schema.sql"), "missing schema.sql")) {
            var schema = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            useHandle(handle -> handle.createScript(schema).executeAsSeparateStatements());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @CreateSqlObject
    LedgerDAO ledger();

    @CreateSqlObject
    RunDAO runs();

    default HikariDataSource dataSource() {
        return withHandle(handle -> handle.getConfig(DataSourceHolder.class).dataSource);
    }

    default void close() {
        dataSource().close();
    }

    class DataSourceHolder implements JdbiConfig<DataSourceHolder> {
        private HikariDataSource dataSource;

        public DataSourceHolder() {
        }

        @Override
        public DataSourceHolder createCopy() {
            var copy = new DataSourceHolder();
            copy.dataSource = dataSource;
            return copy;
        }
    }
}
