package org.netpreserve.hubfinder;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.argument.ArgumentFactory;
import org.jdbi.v3.core.argument.NullArgument;
import org.jdbi.v3.core.config.JdbiConfig;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.ParsedSql;
import org.jdbi.v3.core.statement.SqlLogger;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.CreateSqlObject;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.jdbi.v3.sqlobject.transaction.Transactional;
import org.netpreserve.hubfinder.db.HubRecordDAO;
import org.netpreserve.hubfinder.db.LearnedPatternDAO;
import org.netpreserve.hubfinder.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Types;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import static org.jdbi.v3.core.generic.GenericTypes.getErasedType;

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
        config.setConnectionInitSql("PRAGMA synchronous = NORMAL; PRAGMA foreign_keys = ON; PRAGMA busy_timeout = 60000;");
        config.setMaximumPoolSize(1);
        var dataSource = new HikariDataSource(config);
        var jdbi = Jdbi.create(dataSource);
        jdbi.installPlugin(new SqlObjectPlugin());
        jdbi.registerColumnMapper(Url.class, stringColumnMapper(Url::new));
        jdbi.registerArgument(stringArgument(Url.class, Url::toString));
        jdbi.getConfig(DataSourceHolder.class).dataSource = dataSource;
        jdbi.setSqlLogger(new SqlLogger() {
            private static final Logger log = LoggerFactory.getLogger(Database.class);

            @Override
            public void logAfterExecution(StatementContext context) {
                if (context.getExecutionMoment() == null || context.getCompletionMoment() == null) return;
                var duration = Duration.between(context.getExecutionMoment(), context.getCompletionMoment());
                var durationMillis = duration.toMillis();
                if (durationMillis > 100) {
                    ParsedSql parsedSql = context.getParsedSql();
                    String sql = parsedSql != null ? parsedSql.getSql() : "<sql unavailable>";
                    log.warn("[Slow SQL] {}ms {}", durationMillis, sql);
                }
            }
        });
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
                return (pos, stmt, ctx) -> stmt.setString(pos, getter.apply((T) value));
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

    /**
     * Cheap round trip used by the startup storage check.
     */
    default void ping() {
        useHandle(handle -> handle.createQuery("SELECT 1").mapTo(Integer.class).one());
    }

    @CreateSqlObject
    HubRecordDAO hubRecords();

    @CreateSqlObject
    LearnedPatternDAO learnedPatterns();

    @CreateSqlObject
    ProgressDAO progress();

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
