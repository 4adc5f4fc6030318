package io.fleetgate.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.fleetgate.backup.BackupOrchestrator;
import io.fleetgate.backup.BackupScheduler;
import io.fleetgate.backup.BackupTransport;
import io.fleetgate.backup.BorgBackupTransport;
import io.fleetgate.command.CommandBackend;
import io.fleetgate.command.CommandDispatcher;
import io.fleetgate.command.CommandWatchdog;
import io.fleetgate.config.FleetGateConfig;
import io.fleetgate.config.FleetSettings;
import io.fleetgate.error.FleetGateException;
import io.fleetgate.error.ThrottledException;
import io.fleetgate.model.BackupOutcome;
import io.fleetgate.model.BackupRun;
import io.fleetgate.model.CommandExecution;
import io.fleetgate.model.MinionIdentity;
import io.fleetgate.model.TrustState;
import io.fleetgate.observability.AuditLogger;
import io.fleetgate.observability.PrometheusFormatter;
import io.fleetgate.salt.SaltApiClient;
import io.fleetgate.security.Capability;
import io.fleetgate.security.OperatorPrincipal;
import io.fleetgate.storage.BackupRunStore;
import io.fleetgate.storage.CommandStore;
import io.fleetgate.storage.Database;
import io.fleetgate.storage.MinionStore;
import io.fleetgate.throttle.AdmissionThrottle;
import io.fleetgate.throttle.EndpointClass;
import io.fleetgate.trust.FingerprintVerifier;
import io.fleetgate.trust.TrustBackend;
import io.fleetgate.trust.TrustLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class FleetGateRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FleetGateRuntime.class);
    private static final int SUBMIT_THREADS = 4;
    private static final long BORG_COMMAND_TIMEOUT_MS = 6L * 60L * 60L * 1000L;
    private static final long BACKUP_SCHEDULER_INITIAL_DELAY_MS = 60_000L;

    private final FleetGateConfig config;
    private final FleetSettings settings;
    private final Clock clock;
    private final Database database;
    private final MinionStore minionStore;
    private final CommandStore commandStore;
    private final BackupRunStore backupRunStore;
    private final AuditLogger auditLogger;
    private final AdmissionThrottle throttle;
    private final TrustLedger trustLedger;
    private final CommandDispatcher dispatcher;
    private final CommandWatchdog watchdog;
    private final BackupOrchestrator backupOrchestrator;
    private final BackupScheduler backupScheduler;
    private final ExecutorService submitExecutor;
    private final ExecutorService backupExecutor;
    private final List<AutoCloseable> ownedResources;

    public FleetGateRuntime(FleetGateConfig config) {
        this(config, FleetSettings.load(config.settingsFile()), Clock.systemUTC());
    }

    private FleetGateRuntime(FleetGateConfig config, FleetSettings settings, Clock clock) {
        this(config, settings, SaltApiClient.fromSettings(settings, clock), clock);
    }

    private FleetGateRuntime(FleetGateConfig config, FleetSettings settings, SaltApiClient salt, Clock clock) {
        this(config, settings, salt, salt,
                new BorgBackupTransport(settings.backup().borgBinary(), BORG_COMMAND_TIMEOUT_MS, config.backupStagingRoot()),
                clock);
        ownedResources.add(salt);
    }

    public FleetGateRuntime(
            FleetGateConfig config,
            FleetSettings settings,
            TrustBackend trustBackend,
            CommandBackend commandBackend,
            BackupTransport backupTransport,
            Clock clock
    ) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.database = new Database(config);
        this.minionStore = new MinionStore(database);
        this.commandStore = new CommandStore(database);
        this.backupRunStore = new BackupRunStore(database);
        this.auditLogger = new AuditLogger(config.auditFile(), settings.auditSigningSecret());
        this.throttle = AdmissionThrottle.fromSettings(settings);
        this.trustLedger = new TrustLedger(minionStore, new FingerprintVerifier(trustBackend), trustBackend, clock);
        this.submitExecutor = Executors.newFixedThreadPool(SUBMIT_THREADS, daemonThreads("fleetgate-command-submit-"));
        this.dispatcher = new CommandDispatcher(
                commandStore,
                minionStore,
                throttle,
                commandBackend,
                submitExecutor,
                auditLogger,
                clock,
                settings.outputMaxBytes(),
                settings.defaultCommandTimeoutMs()
        );
        this.watchdog = new CommandWatchdog(dispatcher, clock, settings.watchdogIntervalMs());
        this.backupOrchestrator = new BackupOrchestrator(backupRunStore, backupTransport, auditLogger, clock, config.secretsDir());
        this.backupScheduler = new BackupScheduler(backupOrchestrator, settings::backup);
        this.backupExecutor = Executors.newSingleThreadExecutor(daemonThreads("fleetgate-backup-manual-"));
        this.ownedResources = new ArrayList<>();
    }

    /** Creates directories and schema, then releases decision claims left by a dead process. */
    public void init() {
        database.init();
        trustLedger.recoverStaleClaims(Duration.ofMillis(settings.decisionClaimStaleMs()));
    }

    /**
     * Starts the long-running tasks of a serving process: the command watchdog and, when enabled,
     * the backup scheduler. Unfinished backup runs are closed first; only one serving process may
     * own a data root.
     */
    public void startBackgroundTasks() {
        backupOrchestrator.recoverAbandonedRuns();
        int resumed = dispatcher.resumeActive();
        if (resumed > 0) {
            log.info("Resumed result tracking for {} active execution(s)", resumed);
        }
        startWatchdog();
        if (settings.backup().enabled()) {
            backupScheduler.start(BACKUP_SCHEDULER_INITIAL_DELAY_MS);
        } else {
            log.info("Backups disabled, scheduler not started");
        }
    }

    /** Starts only the command watchdog, for short-lived processes waiting on their own dispatch. */
    public void startWatchdog() {
        watchdog.start();
    }

    public FleetGateConfig config() {
        return config;
    }

    public FleetSettings settings() {
        return settings;
    }

    public MinionIdentity handshake(String clientKey, String minionId, String fingerprint) {
        throttle(EndpointClass.HANDSHAKE, clientKey, "trust.handshake");
        try {
            MinionIdentity identity = trustLedger.recordPending(minionId, fingerprint);
            audit("trust.handshake", "minion:" + identity.id(), "minion:" + identity.id(), identity.state().name(),
                    Map.of("client", safeKey(clientKey)));
            return identity;
        } catch (FleetGateException e) {
            audit("trust.handshake", "minion:" + minionId, "minion:" + minionId, e.code(),
                    Map.of("client", safeKey(clientKey), "error", e.getMessage()));
            throw e;
        }
    }

    /**
     * Applies an operator decision ({@code accept} or {@code reject}). Accepting requires the
     * fingerprint the operator confirmed; a reject ignores it.
     */
    public MinionIdentity decide(OperatorPrincipal principal, String clientKey, String minionId, String decision, String fingerprint) {
        throttle(EndpointClass.TRUST_DECISION, clientKey, "trust.decision");
        principal.require(Capability.DECIDE_TRUST);
        String normalized = decision == null ? "" : decision.trim().toLowerCase(Locale.ROOT);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("decision", normalized);
        details.put("client", safeKey(clientKey));
        try {
            MinionIdentity out = switch (normalized) {
                case "accept" -> trustLedger.accept(minionId, fingerprint, principal.id());
                case "reject" -> trustLedger.reject(minionId, principal.id());
                default -> throw new IllegalArgumentException("decision must be accept or reject");
            };
            audit("trust.decision", principal.id(), "minion:" + out.id(), out.state().name(), details);
            return out;
        } catch (FleetGateException e) {
            details.put("error", e.getMessage());
            audit("trust.decision", principal.id(), "minion:" + minionId, e.code(), details);
            throw e;
        }
    }

    public MinionIdentity minion(OperatorPrincipal principal, String minionId) {
        principal.require(Capability.VIEW_FLEET);
        return trustLedger.status(minionId);
    }

    public List<MinionIdentity> minions(OperatorPrincipal principal, TrustState stateFilter, int limit) {
        principal.require(Capability.VIEW_FLEET);
        return trustLedger.list(stateFilter, clamp(limit, 1, 1000));
    }

    /** Dispatch is throttled per authenticated subject. */
    public CommandExecution dispatch(OperatorPrincipal principal, String targetMinionId, String payload, Duration timeout) {
        principal.require(Capability.DISPATCH_COMMAND);
        try {
            return dispatcher.dispatch(principal.id(), targetMinionId, payload, timeout, principal.id());
        } catch (ThrottledException e) {
            auditThrottled("command.dispatch", principal.id(), e);
            throw e;
        }
    }

    public CommandExecution command(OperatorPrincipal principal, String executionId) {
        principal.require(Capability.VIEW_FLEET);
        return dispatcher.get(executionId);
    }

    public List<CommandExecution> commands(OperatorPrincipal principal, String targetMinionId, int limit) {
        principal.require(Capability.VIEW_FLEET);
        return dispatcher.list(targetMinionId, clamp(limit, 1, 1000));
    }

    public CommandExecution awaitCommand(OperatorPrincipal principal, String executionId, Duration maxWait) throws InterruptedException {
        principal.require(Capability.VIEW_FLEET);
        return dispatcher.await(executionId, maxWait);
    }

    /** One watchdog pass; the serving process runs this periodically. */
    public int watchdogSweep() {
        return dispatcher.watchdogSweep(clock.millis());
    }

    /** Runs a manual backup. Empty when a run for the same target is already in flight. */
    public Optional<BackupRun> triggerBackup(OperatorPrincipal principal) {
        principal.require(Capability.MANAGE_BACKUPS);
        audit("backup.trigger", principal.id(), "backup", "requested", Map.of());
        return backupOrchestrator.trigger(settings.backup());
    }

    /**
     * Starts a manual backup on the runtime's backup thread and returns at once. Capability and
     * enablement are checked before anything is scheduled.
     */
    public CompletableFuture<Optional<BackupRun>> triggerBackupAsync(OperatorPrincipal principal) {
        principal.require(Capability.MANAGE_BACKUPS);
        if (!settings.backup().enabled()) {
            throw new IllegalStateException("Backups are not enabled");
        }
        audit("backup.trigger", principal.id(), "backup", "scheduled", Map.of());
        return CompletableFuture.supplyAsync(() -> backupOrchestrator.trigger(settings.backup()), backupExecutor);
    }

    public Optional<BackupRun> lastBackupRun(OperatorPrincipal principal) {
        principal.require(Capability.VIEW_FLEET);
        return backupOrchestrator.lastRun();
    }

    public StatsOutcome stats() {
        Optional<BackupRun> lastBackup = backupOrchestrator.lastRun();
        long lastFinished = lastBackup.map(BackupRun::finishedAtMs).orElse(0L);
        long lastSucceeded = lastBackup
                .map(BackupRun::outcome)
                .filter(o -> o == BackupOutcome.SUCCESS || o == BackupOutcome.INITIALIZED_AND_SUCCEEDED)
                .isPresent() ? 1L : 0L;
        return new StatsOutcome(
                minionStore.countByState(),
                commandStore.countByState(),
                backupRunStore.countByOutcome(),
                throttle.deniedCounts(),
                throttle.trackedKeys(),
                dispatcher.watchdogTimeouts(),
                dispatcher.submitFailures(),
                lastFinished,
                lastSucceeded
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats());
    }

    public HealthOutcome health() {
        List<Database.SchemaMigrationRow> migrations = database.listSchemaMigrations();
        boolean migrationsOk = migrations.stream().allMatch(Database.SchemaMigrationRow::success);
        return new HealthOutcome(
                migrationsOk ? "ok" : "degraded",
                config.rootDir().toString(),
                migrations.size(),
                settings.backup().enabled(),
                auditLogger.currentHash()
        );
    }

    public List<JsonNode> auditTail(int limit) {
        return auditLogger.tail(clamp(limit, 1, 10_000));
    }

    public AuditLogger.Verification auditVerify() {
        return auditLogger.verify();
    }

    @Override
    public void close() {
        backupScheduler.close();
        watchdog.close();
        backupExecutor.shutdownNow();
        submitExecutor.shutdown();
        try {
            if (!submitExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                submitExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            submitExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        for (AutoCloseable resource : ownedResources) {
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Failed to close {}", resource.getClass().getSimpleName(), e);
            }
        }
    }

    private void throttle(EndpointClass endpointClass, String clientKey, String action) {
        try {
            throttle.acquire(endpointClass, clientKey, clock.millis());
        } catch (ThrottledException e) {
            auditThrottled(action, "client:" + safeKey(clientKey), e);
            throw e;
        }
    }

    private void auditThrottled(String action, String actor, ThrottledException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("endpoint_class", e.endpointClass());
        details.put("retry_after_ms", e.retryAfter().toMillis());
        audit(action, actor, "throttle:" + e.endpointClass(), e.code(), details);
    }

    private void audit(String action, String actor, String resource, String result, Map<String, Object> details) {
        auditLogger.log(AuditLogger.AuditEvent.of(action, actor, resource, result, details));
    }

    private static String safeKey(String clientKey) {
        return clientKey == null || clientKey.isBlank() ? "unknown" : clientKey.trim();
    }

    private static int clamp(int value, int min, int max) {
        if (value < min) {
            return min;
        }
        return Math.min(value, max);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread thread = new Thread(r, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public record StatsOutcome(
            Map<String, Integer> minionsByState,
            Map<String, Integer> commandsByState,
            Map<String, Integer> backupRunsByOutcome,
            Map<String, Long> throttleDeniedByClass,
            long throttleTrackedKeys,
            long watchdogTimeoutsTotal,
            long submitFailuresTotal,
            long lastBackupFinishedAtMs,
            long lastBackupSucceeded
    ) {
    }

    public record HealthOutcome(
            String status,
            String rootDir,
            int schemaMigrations,
            boolean backupsEnabled,
            String auditHeadHash
    ) {
    }
}
