package io.fleetgate.storage;

import io.fleetgate.model.CommandExecution;
import io.fleetgate.model.CommandState;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence for command executions. Transitions are compare-and-set on {@code state}: the
 * UPDATE names the states it may leave and sets {@code finished_at_ms} in the same statement, so
 * a terminal row always has a finish time and no row is finished twice.
 */
public final class CommandStore {
    private static final String COLUMNS = """
            execution_id,target_minion_id,payload,state,timeout_ms,started_at_ms,acknowledged_at_ms,
            finished_at_ms,exit_code,output,output_truncated,submission_handle,error,requested_by
            """;
    private static final String ACTIVE = "state IN ('" + CommandState.QUEUED.name() + "','" + CommandState.RUNNING.name() + "')";

    private final Database database;

    public CommandStore(Database database) {
        this.database = database;
    }

    public void insertQueued(String executionId, String targetMinionId, String payload, long timeoutMs,
                             String requestedBy, long nowMs) {
        String sql = """
                INSERT INTO command_executions(execution_id,target_minion_id,payload,state,timeout_ms,started_at_ms,requested_by,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?)
                """;
        exec(sql, ps -> {
            ps.setString(1, executionId);
            ps.setString(2, targetMinionId);
            ps.setString(3, payload);
            ps.setString(4, CommandState.QUEUED.name());
            ps.setLong(5, timeoutMs);
            ps.setLong(6, nowMs);
            ps.setString(7, requestedBy == null ? "" : requestedBy);
            ps.setLong(8, nowMs);
        }, "Failed to insert command execution");
    }

    public Optional<CommandExecution> find(String executionId) {
        String sql = "SELECT " + COLUMNS + " FROM command_executions WHERE execution_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(map(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read command execution", e);
        }
    }

    public List<CommandExecution> list(String targetMinionId, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM command_executions"
                + (targetMinionId == null ? "" : " WHERE target_minion_id=?")
                + " ORDER BY started_at_ms DESC, execution_id DESC LIMIT ?";
        List<CommandExecution> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            if (targetMinionId != null) {
                ps.setString(idx++, targetMinionId);
            }
            ps.setInt(idx, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list command executions", e);
        }
    }

    public void recordSubmissionHandle(String executionId, String handle, long nowMs) {
        exec("UPDATE command_executions SET submission_handle=?,updated_at_ms=? WHERE execution_id=?", ps -> {
            ps.setString(1, handle);
            ps.setLong(2, nowMs);
            ps.setString(3, executionId);
        }, "Failed to record submission handle");
    }

    public boolean tryMarkRunning(String executionId, long nowMs) {
        String sql = "UPDATE command_executions SET state=?,acknowledged_at_ms=?,updated_at_ms=? WHERE execution_id=? AND state=?";
        return update(sql, ps -> {
            ps.setString(1, CommandState.RUNNING.name());
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.setString(4, executionId);
            ps.setString(5, CommandState.QUEUED.name());
        }, "Failed to mark command running") == 1;
    }

    /** QUEUED or RUNNING to COMPLETED/FAILED carrying the backend result. */
    public boolean tryFinishWithResult(String executionId, CommandState terminal, int exitCode, String output,
                                       boolean truncated, long nowMs) {
        String sql = "UPDATE command_executions SET state=?,exit_code=?,output=?,output_truncated=?,finished_at_ms=?,updated_at_ms=? "
                + "WHERE execution_id=? AND " + ACTIVE;
        return update(sql, ps -> {
            ps.setString(1, terminal.name());
            ps.setInt(2, exitCode);
            if (output == null) {
                ps.setNull(3, Types.VARCHAR);
            } else {
                ps.setString(3, output);
            }
            ps.setInt(4, truncated ? 1 : 0);
            ps.setLong(5, nowMs);
            ps.setLong(6, nowMs);
            ps.setString(7, executionId);
        }, "Failed to apply command result") == 1;
    }

    /** Submission never reached the backend; only a still-QUEUED row may fail this way. */
    public boolean tryFailQueued(String executionId, String error, long nowMs) {
        String sql = "UPDATE command_executions SET state=?,error=?,finished_at_ms=?,updated_at_ms=? WHERE execution_id=? AND state=?";
        return update(sql, ps -> {
            ps.setString(1, CommandState.FAILED.name());
            ps.setString(2, error);
            ps.setLong(3, nowMs);
            ps.setLong(4, nowMs);
            ps.setString(5, executionId);
            ps.setString(6, CommandState.QUEUED.name());
        }, "Failed to mark submission failure") == 1;
    }

    public List<String> listOverdue(long nowMs, int limit) {
        String sql = "SELECT execution_id FROM command_executions WHERE " + ACTIVE
                + " AND started_at_ms + timeout_ms < ? ORDER BY started_at_ms ASC LIMIT ?";
        List<String> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list overdue command executions", e);
        }
    }

    public List<CommandExecution> listActiveSubmitted(int limit) {
        String sql = "SELECT " + COLUMNS + " FROM command_executions WHERE " + ACTIVE
                + " AND submission_handle IS NOT NULL AND submission_handle<>'' ORDER BY started_at_ms ASC LIMIT ?";
        List<CommandExecution> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list submitted command executions", e);
        }
    }

    /** Deadline is re-checked inside the UPDATE so a concurrent result always wins a tie. */
    public boolean tryMarkTimedOut(String executionId, long nowMs) {
        String sql = "UPDATE command_executions SET state=?,error=?,finished_at_ms=?,updated_at_ms=? "
                + "WHERE execution_id=? AND " + ACTIVE + " AND started_at_ms + timeout_ms < ?";
        return update(sql, ps -> {
            ps.setString(1, CommandState.TIMED_OUT.name());
            ps.setString(2, "watchdog deadline exceeded");
            ps.setLong(3, nowMs);
            ps.setLong(4, nowMs);
            ps.setString(5, executionId);
            ps.setLong(6, nowMs);
        }, "Failed to mark command timed out") == 1;
    }

    public Map<String, Integer> countByState() {
        String sql = "SELECT state, COUNT(1) AS c FROM command_executions GROUP BY state";
        Map<String, Integer> out = new LinkedHashMap<>();
        for (CommandState state : CommandState.values()) {
            out.put(state.name(), 0);
        }
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString(1), rs.getInt(2));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count command executions", e);
        }
    }

    private static CommandExecution map(ResultSet rs) throws SQLException {
        return new CommandExecution(
                rs.getString("execution_id"),
                rs.getString("target_minion_id"),
                rs.getString("payload"),
                CommandState.valueOf(rs.getString("state")),
                rs.getLong("timeout_ms"),
                rs.getLong("started_at_ms"),
                rs.getObject("acknowledged_at_ms") == null ? null : rs.getLong("acknowledged_at_ms"),
                rs.getObject("finished_at_ms") == null ? null : rs.getLong("finished_at_ms"),
                rs.getObject("exit_code") == null ? null : rs.getInt("exit_code"),
                rs.getString("output"),
                rs.getInt("output_truncated") == 1,
                rs.getString("submission_handle"),
                rs.getString("error"),
                rs.getString("requested_by")
        );
    }

    private void exec(String sql, Binder binder, String failure) {
        update(sql, binder, failure);
    }

    private int update(String sql, Binder binder, String failure) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException(failure, e);
        }
    }

    private interface Binder { void bind(PreparedStatement ps) throws SQLException; }
}
