package io.fleetgate.storage;

import io.fleetgate.config.FleetGateConfig;

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
import java.util.List;
import java.util.Properties;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "fleetgate.schema.migration.v1";
    private static final String BUSY_TIMEOUT_MS = "5000";

    private final FleetGateConfig config;
    private final String jdbcUrl;

    public Database(FleetGateConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public FleetGateConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    /**
     * Every connection carries the busy timeout so concurrent single-statement writers wait for
     * the write lock instead of failing with SQLITE_BUSY.
     */
    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", BUSY_TIMEOUT_MS);
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.securityRoot());
            Files.createDirectories(config.secretsDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS minions (
                        minion_id TEXT PRIMARY KEY,
                        fingerprint TEXT NOT NULL,
                        state TEXT NOT NULL,
                        first_seen_at_ms INTEGER NOT NULL,
                        decided_at_ms INTEGER,
                        decided_by TEXT,
                        claim_token TEXT,
                        claimed_at_ms INTEGER,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS command_executions (
                        execution_id TEXT PRIMARY KEY,
                        target_minion_id TEXT NOT NULL,
                        payload TEXT NOT NULL,
                        state TEXT NOT NULL,
                        timeout_ms INTEGER NOT NULL,
                        started_at_ms INTEGER NOT NULL,
                        acknowledged_at_ms INTEGER,
                        finished_at_ms INTEGER,
                        exit_code INTEGER,
                        output TEXT,
                        output_truncated INTEGER NOT NULL DEFAULT 0,
                        submission_handle TEXT,
                        error TEXT,
                        requested_by TEXT NOT NULL DEFAULT '',
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS backup_runs (
                        run_id TEXT PRIMARY KEY,
                        repository_target TEXT NOT NULL,
                        trigger_source TEXT NOT NULL,
                        archive_name TEXT NOT NULL,
                        started_at_ms INTEGER NOT NULL,
                        finished_at_ms INTEGER,
                        outcome TEXT,
                        error_detail TEXT,
                        original_size INTEGER,
                        compressed_size INTEGER,
                        deduplicated_size INTEGER,
                        file_count INTEGER
                    )
                    """);
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
                "20261001_001_lookup_indexes",
                "Add state/time indexes for minion listing and watchdog sweeps",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_minions_state ON minions(state, first_seen_at_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_commands_state_started ON command_executions(state, started_at_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_backup_runs_target_started ON backup_runs(repository_target, started_at_ms)"
                )
        ));
        steps.add(new MigrationStep(
                "20261001_002_backup_single_flight",
                "At most one unfinished backup run per repository target",
                List.of(
                        "CREATE UNIQUE INDEX IF NOT EXISTS uq_backup_runs_inflight ON backup_runs(repository_target) WHERE finished_at_ms IS NULL"
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

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
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
                ORDER BY applied_at_ms DESC, version DESC
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

    private record MigrationStep(String version, String description, List<String> sql) {
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
