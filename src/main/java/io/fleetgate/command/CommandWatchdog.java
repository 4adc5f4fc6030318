package io.fleetgate.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically runs {@link CommandDispatcher#watchdogSweep(long)} on a daemon thread. Each tick
 * first hands active executions back to the backend, so jobs dispatched by short-lived CLI
 * processes still get their results.
 */
public final class CommandWatchdog implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CommandWatchdog.class);

    private final CommandDispatcher dispatcher;
    private final Clock clock;
    private final long intervalMs;
    private ScheduledExecutorService executor;

    public CommandWatchdog(CommandDispatcher dispatcher, Clock clock, long intervalMs) {
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.intervalMs = Math.max(100L, intervalMs);
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "fleetgate-command-watchdog");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(() -> {
            try {
                dispatcher.resumeActive();
                int moved = dispatcher.watchdogSweep(clock.millis());
                if (moved > 0) {
                    log.info("Watchdog timed out {} execution(s)", moved);
                }
            } catch (RuntimeException e) {
                log.warn("Command watchdog sweep failed", e);
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Command watchdog started (interval={}ms)", intervalMs);
    }

    @Override
    public synchronized void close() {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        executor = null;
        log.info("Command watchdog stopped");
    }
}
