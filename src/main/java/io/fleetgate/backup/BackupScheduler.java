package io.fleetgate.backup;

import io.fleetgate.config.BackupSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/** Runs {@link BackupOrchestrator#runScheduled} at the configured interval on a daemon thread. */
public final class BackupScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BackupScheduler.class);

    private final BackupOrchestrator orchestrator;
    private final Supplier<BackupSettings> settings;
    private ScheduledExecutorService executor;

    public BackupScheduler(BackupOrchestrator orchestrator, Supplier<BackupSettings> settings) {
        this.orchestrator = orchestrator;
        this.settings = settings;
    }

    public synchronized void start(long initialDelayMs) {
        if (executor != null) {
            return;
        }
        long intervalMs = Math.max(60_000L, settings.get().intervalMs());
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "fleetgate-backup-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleAtFixedRate(() -> {
            try {
                orchestrator.runScheduled(settings.get());
            } catch (RuntimeException e) {
                log.error("Scheduled backup tick failed", e);
            }
        }, Math.max(0L, initialDelayMs), intervalMs, TimeUnit.MILLISECONDS);
        log.info("Backup scheduler started (interval={}ms)", intervalMs);
    }

    @Override
    public synchronized void close() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        executor = null;
        log.info("Backup scheduler stopped");
    }
}
