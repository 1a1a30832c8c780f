package reminders.dispatcher.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reminders.dispatcher.config.DispatcherConfig;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;

/**
 * Pooled access to the reminder store.
 * <p>
 * Connections come from a HikariCP pool with auto-commit disabled, so every
 * repository call commits explicitly. The {@code tasks} table is created on first
 * start and columns added later are migrated in place.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    static final String POOL_NAME = "reminders-db-pool";

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS tasks (
                id                VARCHAR(64) PRIMARY KEY,
                name              VARCHAR(255) NOT NULL,
                description       CLOB,
                priority          VARCHAR(10) DEFAULT 'MEDIUM' NOT NULL,
                trigger_at        TIMESTAMP NOT NULL,
                cadence           VARCHAR(10) DEFAULT 'NONE' NOT NULL,
                sent_once         BOOLEAN DEFAULT FALSE NOT NULL,
                last_notified_at  TIMESTAMP,
                recipients        VARCHAR(2048),
                visibility        VARCHAR(10) DEFAULT 'PUBLIC' NOT NULL,
                created_by        VARCHAR(255),
                updated_by        VARCHAR(255),
                created_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                updated_at        TIMESTAMP
            )
            """,
            "ALTER TABLE tasks ADD COLUMN IF NOT EXISTS visibility VARCHAR(10) DEFAULT 'PUBLIC' NOT NULL",
            "CREATE INDEX IF NOT EXISTS idx_tasks_due ON tasks(trigger_at, cadence, sent_once)");

    private final HikariDataSource pool;
    private final int queryTimeoutSeconds;

    public Database(DispatcherConfig config) {
        Duration timeout = config.repositoryTimeout();
        this.pool = new HikariDataSource(poolConfig(config.databaseUrl(), config.databasePoolSize(), timeout));
        this.queryTimeoutSeconds = (int) Math.max(1, timeout.toSeconds());
        log.info("Opened {} ({} connections) on {}", POOL_NAME, config.databasePoolSize(), config.databaseUrl());

        migrate();
    }

    static HikariConfig poolConfig(String jdbcUrl, int poolSize, Duration timeout) {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName(POOL_NAME);
        hikari.setJdbcUrl(jdbcUrl);
        hikari.setMaximumPoolSize(poolSize);
        hikari.setMinimumIdle(Math.min(2, poolSize));
        hikari.setAutoCommit(false);
        // a stalled pool must not hold a dispatch tick longer than one repository call
        hikari.setConnectionTimeout(Math.max(250, timeout.toMillis()));
        hikari.setIdleTimeout(Duration.ofMinutes(5).toMillis());
        if (jdbcUrl.startsWith("jdbc:h2:")) {
            hikari.addDataSourceProperty("MODE", "PostgreSQL");
        }
        return hikari;
    }

    /**
     * Borrow a pooled connection. Closing it returns it to the pool.
     */
    public Connection getConnection() throws SQLException {
        return pool.getConnection();
    }

    /** Statement timeout in seconds, derived from the repository timeout. */
    public int queryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Store unreachable: {}", e.getMessage());
            return false;
        }
    }

    private void migrate() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                st.execute(ddl);
            }
            conn.commit();
            log.info("Task schema ready ({} statements)", SCHEMA.size());
        } catch (SQLException e) {
            pool.close();
            throw JdbcTaskRepository.translate("Failed to prepare task schema", e);
        }
    }

    @Override
    public void close() {
        if (!pool.isClosed()) {
            pool.close();
            log.info("Closed {}", POOL_NAME);
        }
    }
}
