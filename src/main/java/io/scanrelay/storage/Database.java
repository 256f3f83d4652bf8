package io.scanrelay.storage;

import io.scanrelay.config.ScanRelayConfig;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * SQLite-backed store shared by every process that points at the same root.
 * Connections begin their transactions IMMEDIATE, so a write transaction holds
 * the database write lock from its first statement and concurrent claimers
 * queue on {@code busy_timeout} instead of failing at commit.
 */
public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "scanrelay.schema.migration.v1";
    private final ScanRelayConfig config;
    private final String jdbcUrl;
    private final Properties connectionProperties;
    private final Clock clock;

    public Database(ScanRelayConfig config) {
        this(config, Clock.systemUTC());
    }

    public Database(ScanRelayConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        sqlite.setBusyTimeout((int) ScanRelayConfig.DEFAULT_BUSY_TIMEOUT_MS);
        sqlite.enforceForeignKeys(true);
        this.connectionProperties = sqlite.toProperties();
    }

    public String namespace() {
        return config.namespace();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    /**
     * Cheap reachability probe used by health checks.
     */
    public boolean ping() {
        try (Connection c = openConnection(); Statement st = c.createStatement();
             ResultSet rs = st.executeQuery("SELECT 1")) {
            return rs.next() && rs.getInt(1) == 1;
        } catch (SQLException e) {
            return false;
        }
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.reportsRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS jobs (
                        job_id TEXT PRIMARY KEY,
                        namespace TEXT NOT NULL DEFAULT 'default',
                        job_type TEXT NOT NULL,
                        priority TEXT NOT NULL,
                        status TEXT NOT NULL,
                        progress INTEGER NOT NULL DEFAULT 0,
                        tenant_id TEXT NOT NULL DEFAULT '',
                        payload TEXT NOT NULL,
                        meta TEXT NOT NULL,
                        result_payload TEXT,
                        error_kind TEXT,
                        last_error TEXT,
                        worker_id TEXT,
                        timeout_ms INTEGER NOT NULL,
                        result_ttl_ms INTEGER NOT NULL,
                        failure_ttl_ms INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        started_at_ms INTEGER,
                        deadline_at_ms INTEGER,
                        ended_at_ms INTEGER,
                        expires_at_ms INTEGER,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS job_queue (
                        seq INTEGER PRIMARY KEY AUTOINCREMENT,
                        job_id TEXT NOT NULL UNIQUE,
                        tier_rank INTEGER NOT NULL,
                        enqueued_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(job_id) REFERENCES jobs(job_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS job_history (
                        seq INTEGER PRIMARY KEY AUTOINCREMENT,
                        job_id TEXT NOT NULL,
                        from_status TEXT,
                        to_status TEXT NOT NULL,
                        worker_id TEXT,
                        detail TEXT,
                        at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS findings (
                        finding_id TEXT PRIMARY KEY,
                        tenant_id TEXT NOT NULL DEFAULT '',
                        source_job_id TEXT,
                        severity TEXT NOT NULL,
                        confidence REAL NOT NULL,
                        score REAL NOT NULL,
                        category TEXT NOT NULL,
                        source TEXT NOT NULL DEFAULT '',
                        description TEXT NOT NULL DEFAULT '',
                        status TEXT NOT NULL,
                        detected_at_ms INTEGER NOT NULL,
                        resolved_at_ms INTEGER,
                        updated_at_ms INTEGER NOT NULL,
                        updated_by TEXT NOT NULL,
                        note TEXT,
                        version INTEGER NOT NULL DEFAULT 1
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_job_queue_order ON job_queue(tier_rank, seq)");
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize schema", e);
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
                "20261001_001_job_lookup_indexes",
                "Indexes for status sweeps, expiry purge and history lookup",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_jobs_status_deadline ON jobs(status, deadline_at_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_jobs_expires ON jobs(expires_at_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_job_history_job ON job_history(job_id, seq)"
                )
        ));
        steps.add(new MigrationStep(
                "20261001_002_finding_indexes",
                "Indexes for tenant scoped finding listings",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_findings_tenant_status ON findings(tenant_id, status, detected_at_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_findings_source_job ON findings(source_job_id)"
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
            ps.setLong(4, clock.millis());
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
            validatePragma(st, "busy_timeout", String.valueOf(ScanRelayConfig.DEFAULT_BUSY_TIMEOUT_MS));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
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

    public List<SchemaMigrationRow> listSchemaMigrations() {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY version
                """;
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms"),
                        rs.getInt("success") == 1
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
