package io.fleetgate.storage;

import io.fleetgate.model.MinionIdentity;
import io.fleetgate.model.TrustState;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence for minion identities. Every state change is a single conditional UPDATE whose
 * WHERE clause carries the expected prior state, so two racing writers can never both win.
 */
public final class MinionStore {
    private static final String COLUMNS = "minion_id,fingerprint,state,first_seen_at_ms,decided_at_ms,decided_by";

    private final Database database;

    public MinionStore(Database database) {
        this.database = database;
    }

    /** Inserts a PENDING row unless one already exists. Returns true when this call created it. */
    public boolean insertPendingIfAbsent(String minionId, String fingerprint, long nowMs) {
        String sql = """
                INSERT INTO minions(minion_id,fingerprint,state,first_seen_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?)
                ON CONFLICT(minion_id) DO NOTHING
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, minionId);
            ps.setString(2, fingerprint);
            ps.setString(3, TrustState.PENDING.name());
            ps.setLong(4, nowMs);
            ps.setLong(5, nowMs);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record pending minion", e);
        }
    }

    public Optional<MinionIdentity> find(String minionId) {
        String sql = "SELECT " + COLUMNS + " FROM minions WHERE minion_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, minionId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(map(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read minion", e);
        }
    }

    public List<MinionIdentity> list(TrustState stateFilter, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM minions"
                + (stateFilter == null ? "" : " WHERE state=?")
                + " ORDER BY first_seen_at_ms ASC, minion_id ASC LIMIT ?";
        List<MinionIdentity> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int idx = 1;
            if (stateFilter != null) {
                ps.setString(idx++, stateFilter.name());
            }
            ps.setInt(idx, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list minions", e);
        }
    }

    /**
     * Takes the decision claim on a PENDING minion. Fails when another decision already holds
     * the claim or the minion has left PENDING.
     */
    public boolean tryClaimDecision(String minionId, String claimToken, long nowMs) {
        String sql = "UPDATE minions SET claim_token=?,claimed_at_ms=?,updated_at_ms=? WHERE minion_id=? AND state=? AND claim_token IS NULL";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, claimToken);
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.setString(4, minionId);
            ps.setString(5, TrustState.PENDING.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim trust decision", e);
        }
    }

    public boolean commitAccepted(String minionId, String claimToken, String decidedBy, long nowMs) {
        String sql = """
                UPDATE minions SET state=?,decided_at_ms=?,decided_by=?,claim_token=NULL,claimed_at_ms=NULL,updated_at_ms=?
                WHERE minion_id=? AND state=? AND claim_token=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TrustState.ACCEPTED.name());
            ps.setLong(2, nowMs);
            ps.setString(3, decidedBy);
            ps.setLong(4, nowMs);
            ps.setString(5, minionId);
            ps.setString(6, TrustState.PENDING.name());
            ps.setString(7, claimToken);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to commit acceptance", e);
        }
    }

    public boolean releaseClaim(String minionId, String claimToken, long nowMs) {
        String sql = "UPDATE minions SET claim_token=NULL,claimed_at_ms=NULL,updated_at_ms=? WHERE minion_id=? AND claim_token=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setString(2, minionId);
            ps.setString(3, claimToken);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release trust decision claim", e);
        }
    }

    /** PENDING to REJECTED, refused while an accept holds the claim. */
    public boolean tryReject(String minionId, String decidedBy, long nowMs) {
        String sql = """
                UPDATE minions SET state=?,decided_at_ms=?,decided_by=?,updated_at_ms=?
                WHERE minion_id=? AND state=? AND claim_token IS NULL
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, TrustState.REJECTED.name());
            ps.setLong(2, nowMs);
            ps.setString(3, decidedBy);
            ps.setLong(4, nowMs);
            ps.setString(5, minionId);
            ps.setString(6, TrustState.PENDING.name());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to reject minion", e);
        }
    }

    /** Clears decision claims abandoned by a crashed process. */
    public int releaseStaleClaims(long claimedBeforeMs, long nowMs) {
        String sql = "UPDATE minions SET claim_token=NULL,claimed_at_ms=NULL,updated_at_ms=? WHERE state=? AND claim_token IS NOT NULL AND claimed_at_ms<=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, nowMs);
            ps.setString(2, TrustState.PENDING.name());
            ps.setLong(3, claimedBeforeMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release stale decision claims", e);
        }
    }

    public boolean claimHeld(String minionId) {
        String sql = "SELECT claim_token FROM minions WHERE minion_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, minionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getString(1) != null;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read decision claim", e);
        }
    }

    public Map<String, Integer> countByState() {
        String sql = "SELECT state, COUNT(1) AS c FROM minions GROUP BY state";
        Map<String, Integer> out = new LinkedHashMap<>();
        for (TrustState state : TrustState.values()) {
            out.put(state.name(), 0);
        }
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString(1), rs.getInt(2));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count minions", e);
        }
    }

    private static MinionIdentity map(ResultSet rs) throws SQLException {
        return new MinionIdentity(
                rs.getString("minion_id"),
                rs.getString("fingerprint"),
                TrustState.valueOf(rs.getString("state")),
                rs.getLong("first_seen_at_ms"),
                rs.getObject("decided_at_ms") == null ? null : rs.getLong("decided_at_ms"),
                rs.getString("decided_by")
        );
    }
}
