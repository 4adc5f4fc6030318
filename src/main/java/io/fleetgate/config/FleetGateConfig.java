package io.fleetgate.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class FleetGateConfig {
    public static final long DEFAULT_COMMAND_TIMEOUT_MS = 300_000L;
    public static final long MAX_COMMAND_TIMEOUT_MS = 24L * 60L * 60L * 1000L;
    public static final int DEFAULT_OUTPUT_MAX_BYTES = 64 * 1024;
    public static final long DEFAULT_WATCHDOG_INTERVAL_MS = 5_000L;
    public static final long DEFAULT_DECISION_CLAIM_STALE_MS = 5L * 60L * 1000L;
    public static final long DEFAULT_THROTTLE_WINDOW_MS = 60_000L;
    public static final int DEFAULT_HANDSHAKE_LIMIT = 5;
    public static final int DEFAULT_TRUST_DECISION_LIMIT = 10;
    public static final int DEFAULT_COMMAND_DISPATCH_LIMIT = 30;
    public static final long DEFAULT_BACKUP_INTERVAL_MS = 24L * 60L * 60L * 1000L;
    public static final long DEFAULT_SALT_POLL_INTERVAL_MS = 2_000L;

    private final Path rootDir;

    public FleetGateConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static FleetGateConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        return new FleetGateConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("fleetgate.db");
    }

    public Path settingsFile() {
        return rootDir.resolve("fleetgate-settings.json");
    }

    public Path authFile() {
        return rootDir.resolve("auth.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    /** Owner-only directory for short-lived key material materialized by backup runs. */
    public Path secretsDir() {
        return rootDir.resolve("secrets");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path backupStagingRoot() {
        return rootDir.resolve("backup-staging");
    }
}
