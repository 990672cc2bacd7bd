package io.spiderq.storage;

import io.spiderq.config.SpiderqConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "spiderq.schema.migration.v1";
    private static final int BUSY_TIMEOUT_MS = 5_000;

    private final SpiderqConfig config;
    private final String jdbcUrl;

    public Database(SpiderqConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    /**
     * Foreign keys and the busy timeout are per-connection in SQLite, so every connection asks for them.
     */
    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("foreign_keys", "true");
        props.setProperty("busy_timeout", Integer.toString(BUSY_TIMEOUT_MS));
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new StoreException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS tasks (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        task_type TEXT NOT NULL,
                        params TEXT NOT NULL,
                        status TEXT NOT NULL,
                        started_at_ms INTEGER NOT NULL,
                        completed_at_ms INTEGER,
                        error_message TEXT,
                        result_count INTEGER NOT NULL DEFAULT 0,
                        config TEXT
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS logs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        task_id INTEGER NOT NULL,
                        type TEXT NOT NULL,
                        level TEXT,
                        message TEXT NOT NULL,
                        timestamp_ms INTEGER NOT NULL,
                        metadata TEXT,
                        FOREIGN KEY(task_id) REFERENCES tasks(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS task_queue (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        task_config TEXT NOT NULL,
                        priority INTEGER NOT NULL DEFAULT 0,
                        status TEXT NOT NULL DEFAULT 'pending',
                        created_at_ms INTEGER NOT NULL,
                        started_at_ms INTEGER,
                        completed_at_ms INTEGER,
                        task_id INTEGER,
                        error_message TEXT,
                        FOREIGN KEY(task_id) REFERENCES tasks(id)
                    )
                    """);
            ensureTaskColumns(conn);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_status ON tasks(status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_started_at ON tasks(started_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_logs_task_id ON logs(task_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_logs_timestamp ON logs(timestamp_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_queue_status ON task_queue(status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_queue_priority ON task_queue(priority DESC, created_at_ms ASC)");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureTaskColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(tasks)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase());
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("result_count")) {
                st.execute("ALTER TABLE tasks ADD COLUMN result_count INTEGER NOT NULL DEFAULT 0");
            }
            if (!columns.contains("config")) {
                st.execute("ALTER TABLE tasks ADD COLUMN config TEXT");
            }
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261019_001_history_lookup_indexes",
                "Index queue task references and per-task log ordering",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_queue_task_id ON task_queue(task_id)",
                        "CREATE INDEX IF NOT EXISTS idx_logs_task_timestamp ON logs(task_id, timestamp_ms)"
                )
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new StoreException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<String> appliedMigrations() {
        List<String> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT version FROM schema_migrations WHERE success=1 ORDER BY applied_at_ms, version")) {
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list schema migrations", e);
        }
    }
}
