package io.fleetgate.backup;

import io.fleetgate.config.BackupSettings;
import io.fleetgate.model.BackupOutcome;
import io.fleetgate.model.BackupRun;
import io.fleetgate.model.BackupStats;
import io.fleetgate.observability.AuditLogger;
import io.fleetgate.security.SecretRedactor;
import io.fleetgate.storage.BackupRunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Runs the backup protocol: probe the repository, initialize it only when the probe says it does
 * not exist, run the backup, then prune.
 *
 * <p>At most one run per repository target is in flight; a concurrent request for the same
 * target is skipped. Secrets come in with the {@link BackupSettings} of each call and leave
 * nothing behind: the passphrase is wiped after the run and the transport key file is removed on
 * every exit path. Failures are recorded, never retried here.
 */
public final class BackupOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BackupOrchestrator.class);
    private static final Pattern REPOSITORY_URL = Pattern.compile("^(ssh://|file://|/)[a-zA-Z0-9@:./_-]+$");
    private static final Pattern ARCHIVE_NAME = Pattern.compile("^[a-zA-Z0-9_:-]+$");
    private static final DateTimeFormatter ARCHIVE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss").withZone(ZoneOffset.UTC);
    private static final int MAX_ERROR_DETAIL_CHARS = 2_000;

    private final BackupRunStore store;
    private final BackupTransport transport;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final Path secretsDir;
    private final Set<String> inFlightTargets = ConcurrentHashMap.newKeySet();

    public BackupOrchestrator(BackupRunStore store, BackupTransport transport, AuditLogger auditLogger, Clock clock, Path secretsDir) {
        this.store = store;
        this.transport = transport;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.secretsDir = secretsDir;
    }

    /** Scheduler entry point. Disabled settings are a silent no-op. */
    public Optional<BackupRun> runScheduled(BackupSettings settings) {
        if (settings == null || !settings.enabled()) {
            log.debug("Scheduled backup skipped: backups disabled");
            return Optional.empty();
        }
        return execute(settings, "scheduled");
    }

    /**
     * Manual run. Returns empty when a run for the same target is already in flight.
     *
     * @throws IllegalStateException when backups are not enabled
     */
    public Optional<BackupRun> trigger(BackupSettings settings) {
        if (settings == null || !settings.enabled()) {
            throw new IllegalStateException("Backups are not enabled");
        }
        return execute(settings, "manual");
    }

    public Optional<BackupRun> lastRun() {
        return store.latest(null);
    }

    public Optional<BackupRun> lastRun(String repositoryTarget) {
        return store.latest(repositoryTarget);
    }

    /** Startup sweep: closes runs a dead process left open and removes leftover key files. */
    public int recoverAbandonedRuns() {
        int closed = store.failUnfinished("Backup process terminated before the run finished", clock.millis());
        if (closed > 0) {
            log.warn("Marked {} abandoned backup run(s) as FAILED", closed);
        }
        TransportKeyFile.sweepStale(secretsDir);
        return closed;
    }

    private Optional<BackupRun> execute(BackupSettings settings, String trigger) {
        String target = settings.repositoryTarget() == null ? "" : settings.repositoryTarget().trim();
        String maskedTarget = BackupSettings.maskTarget(target);
        if (!inFlightTargets.add(target)) {
            log.info("Backup for {} skipped: a run is already in flight", maskedTarget);
            return Optional.empty();
        }
        try {
            String runId = UUID.randomUUID().toString();
            String archiveName = settings.archivePrefix() + "-" + ARCHIVE_TIMESTAMP.format(clock.instant());
            if (!store.tryOpenRun(runId, target, trigger, archiveName, clock.millis())) {
                log.info("Backup for {} skipped: another process holds an unfinished run", maskedTarget);
                return Optional.empty();
            }
            log.info("Backup run {} started ({}, target={})", runId, trigger, maskedTarget);
            SecretRedactor redactor = SecretRedactor.of(settings.passphrase(), settings.sshKey());
            RunResult result;
            try {
                result = runProtocol(settings, target, archiveName);
            } catch (RuntimeException e) {
                result = RunResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            String errorDetail = result.errorDetail() == null ? null : boundDetail(redactor.redact(result.errorDetail()));
            store.finishRun(runId, result.outcome(), errorDetail, result.stats(), clock.millis());
            if (result.outcome() == BackupOutcome.FAILED) {
                log.warn("Backup run {} failed: {}", runId, errorDetail);
            } else {
                log.info("Backup run {} finished: {}", runId, result.outcome());
            }
            audit(runId, maskedTarget, trigger, result.outcome(), errorDetail);
            return store.find(runId);
        } finally {
            inFlightTargets.remove(target);
        }
    }

    private RunResult runProtocol(BackupSettings settings, String target, String archiveName) {
        validateRepositoryTarget(target);
        validateArchiveName(archiveName);
        BackupRetention retention = new BackupRetention(
                settings.retentionDaily(), settings.retentionWeekly(), settings.retentionMonthly());
        List<Path> sources = resolveSources(settings.sourcePaths());
        if (sources.isEmpty()) {
            return RunResult.failed("No configured backup source path exists");
        }
        try (BackupCredentials credentials = BackupCredentials.of(settings.passphrase());
             TransportKeyFile keyFile = settings.hasSshKey() ? TransportKeyFile.materialize(secretsDir, settings.sshKey()) : null) {
            BackupSession session = new BackupSession(target, credentials, keyFile == null ? null : keyFile.path());
            ProbeResult probe = transport.probe(session);
            boolean initialized = false;
            if (probe.status() == ProbeStatus.NOT_FOUND) {
                log.info("Repository {} not found, initializing", BackupSettings.maskTarget(target));
                TransportResult init = transport.initialize(session);
                if (!init.success()) {
                    return RunResult.failed("Repository initialization failed: " + init.detail());
                }
                initialized = true;
            } else if (probe.status() != ProbeStatus.EXISTS) {
                return RunResult.failed("Repository probe failed (" + probe.status() + "): " + probe.detail());
            }
            TransportResult run = transport.run(session, archiveName, sources);
            if (!run.success()) {
                return RunResult.failed("Backup failed: " + run.detail());
            }
            TransportResult prune = transport.prune(session, retention);
            if (!prune.success()) {
                log.warn("Prune after archive {} failed: {}", archiveName,
                        SecretRedactor.of(settings.passphrase(), settings.sshKey()).redact(prune.detail()));
            }
            return new RunResult(initialized ? BackupOutcome.INITIALIZED_AND_SUCCEEDED : BackupOutcome.SUCCESS, null, run.stats());
        }
    }

    private static List<Path> resolveSources(List<String> configured) {
        List<Path> out = new ArrayList<>();
        for (String raw : configured) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            if (raw.contains("..") || raw.indexOf('\0') >= 0) {
                throw new IllegalArgumentException("Invalid backup source path: path traversal detected");
            }
            Path path = Path.of(raw.trim());
            if (!path.isAbsolute()) {
                throw new IllegalArgumentException("Backup source path must be absolute: " + raw);
            }
            if (Files.exists(path)) {
                out.add(path);
            } else {
                log.warn("Backup source {} does not exist, skipping", path);
            }
        }
        return out;
    }

    static void validateRepositoryTarget(String target) {
        if (target == null || !REPOSITORY_URL.matcher(target).matches()) {
            throw new IllegalArgumentException("Invalid repository URL format: " + BackupSettings.maskTarget(target));
        }
    }

    static void validateArchiveName(String name) {
        if (name == null || !ARCHIVE_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid archive name: " + name);
        }
    }

    private static String boundDetail(String detail) {
        if (detail.length() <= MAX_ERROR_DETAIL_CHARS) {
            return detail;
        }
        return detail.substring(0, MAX_ERROR_DETAIL_CHARS) + "...";
    }

    private void audit(String runId, String maskedTarget, String trigger, BackupOutcome outcome, String errorDetail) {
        if (auditLogger == null) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("target", maskedTarget);
        details.put("trigger", trigger);
        if (errorDetail != null) {
            details.put("error", errorDetail);
        }
        auditLogger.log(AuditLogger.AuditEvent.of("backup.run", "orchestrator", "backup:" + runId, outcome.name(), details));
    }

    private record RunResult(BackupOutcome outcome, String errorDetail, BackupStats stats) {
        static RunResult failed(String detail) {
            return new RunResult(BackupOutcome.FAILED, detail, BackupStats.empty());
        }
    }
}
