package io.fleetgate.backup;

import io.fleetgate.model.BackupStats;

public record TransportResult(boolean success, String detail, BackupStats stats) {
    public static TransportResult ok() {
        return new TransportResult(true, "", BackupStats.empty());
    }

    public static TransportResult ok(BackupStats stats) {
        return new TransportResult(true, "", stats == null ? BackupStats.empty() : stats);
    }

    public static TransportResult failed(String detail) {
        return new TransportResult(false, detail == null ? "" : detail, BackupStats.empty());
    }
}
