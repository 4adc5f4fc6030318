package io.fleetgate.storage;

import io.fleetgate.model.BackupOutcome;
import io.fleetgate.model.BackupRun;
import io.fleetgate.model.BackupStats;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class BackupRunStore {
    private static final String COLUMNS = """
            run_id,repository_target,trigger_source,archive_name,started_at_ms,finished_at_ms,outcome,error_detail,
            original_size,compressed_size,deduplicated_size,file_count
            """;

    private final Database database;

    public BackupRunStore(Database database) {
        this.database = database;
    }

    /**
     * Opens a run. Returns false when another unfinished run already holds the target; the
     * partial unique index on unfinished runs makes that check atomic across processes.
     */
    public boolean tryOpenRun(String runId, String repositoryTarget, String trigger, String archiveName, long nowMs) {
        String sql = """
                INSERT OR IGNORE INTO backup_runs(run_id,repository_target,trigger_source,archive_name,started_at_ms)
                VALUES(?,?,?,?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            ps.setString(2, repositoryTarget);
            ps.setString(3, trigger);
            ps.setString(4, archiveName);
            ps.setLong(5, nowMs);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to open backup run", e);
        }
    }

    public boolean finishRun(String runId, BackupOutcome outcome, String errorDetail, BackupStats stats, long nowMs) {
        String sql = """
                UPDATE backup_runs SET finished_at_ms=?,outcome=?,error_detail=?,
                    original_size=?,compressed_size=?,deduplicated_size=?,file_count=?
                WHERE run_id=? AND finished_at_ms IS NULL
                """;
        BackupStats s = stats == null ? BackupStats.empty() : stats;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setString(2, outcome.name());
            if (errorDetail == null) {
                ps.setNull(3, Types.VARCHAR);
            } else {
                ps.setString(3, errorDetail);
            }
            setNullableLong(ps, 4, s.originalSize());
            setNullableLong(ps, 5, s.compressedSize());
            setNullableLong(ps, 6, s.deduplicatedSize());
            setNullableLong(ps, 7, s.fileCount());
            ps.setString(8, runId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to finish backup run", e);
        }
    }

    public Optional<BackupRun> find(String runId) {
        String sql = "SELECT " + COLUMNS + " FROM backup_runs WHERE run_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(map(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read backup run", e);
        }
    }

    /** Most recent run, optionally scoped to one repository target. */
    public Optional<BackupRun> latest(String repositoryTarget) {
        String sql = "SELECT " + COLUMNS + " FROM backup_runs"
                + (repositoryTarget == null ? "" : " WHERE repository_target=?")
                + " ORDER BY started_at_ms DESC, rowid DESC LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (repositoryTarget != null) {
                ps.setString(1, repositoryTarget);
            }
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(map(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read latest backup run", e);
        }
    }

    /** Closes runs abandoned by a dead process. */
    public int failUnfinished(String errorDetail, long nowMs) {
        String sql = "UPDATE backup_runs SET finished_at_ms=?,outcome=?,error_detail=? WHERE finished_at_ms IS NULL";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setString(2, BackupOutcome.FAILED.name());
            ps.setString(3, errorDetail);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to close abandoned backup runs", e);
        }
    }

    public Map<String, Integer> countByOutcome() {
        String sql = "SELECT COALESCE(outcome,'RUNNING'), COUNT(1) FROM backup_runs GROUP BY COALESCE(outcome,'RUNNING')";
        Map<String, Integer> out = new LinkedHashMap<>();
        for (BackupOutcome outcome : BackupOutcome.values()) {
            out.put(outcome.name(), 0);
        }
        out.put("RUNNING", 0);
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString(1), rs.getInt(2));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count backup runs", e);
        }
    }

    private static void setNullableLong(PreparedStatement ps, int idx, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.BIGINT);
        } else {
            ps.setLong(idx, value);
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column) == null ? null : rs.getLong(column);
    }

    private static BackupRun map(ResultSet rs) throws SQLException {
        String outcome = rs.getString("outcome");
        return new BackupRun(
                rs.getString("run_id"),
                rs.getString("repository_target"),
                rs.getString("trigger_source"),
                rs.getString("archive_name"),
                rs.getLong("started_at_ms"),
                nullableLong(rs, "finished_at_ms"),
                outcome == null ? null : BackupOutcome.valueOf(outcome),
                rs.getString("error_detail"),
                nullableLong(rs, "original_size"),
                nullableLong(rs, "compressed_size"),
                nullableLong(rs, "deduplicated_size"),
                nullableLong(rs, "file_count")
        );
    }
}
