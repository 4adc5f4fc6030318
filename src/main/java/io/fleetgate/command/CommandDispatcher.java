package io.fleetgate.command;

import io.fleetgate.config.FleetGateConfig;
import io.fleetgate.error.CommandTimeoutException;
import io.fleetgate.error.NotFoundException;
import io.fleetgate.error.UnknownTargetException;
import io.fleetgate.model.CommandExecution;
import io.fleetgate.model.CommandState;
import io.fleetgate.model.MinionIdentity;
import io.fleetgate.model.TrustState;
import io.fleetgate.observability.AuditLogger;
import io.fleetgate.storage.CommandStore;
import io.fleetgate.storage.MinionStore;
import io.fleetgate.throttle.AdmissionThrottle;
import io.fleetgate.throttle.EndpointClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives command executions through QUEUED, RUNNING and a terminal state.
 *
 * <p>Backend callbacks and the watchdog race freely; each transition is a compare-and-set on the
 * stored state, so the first writer wins and later ones are logged no-ops.
 */
public final class CommandDispatcher {
    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);
    private static final int SWEEP_BATCH = 200;
    private static final long AWAIT_POLL_MS = 50L;

    private final CommandStore store;
    private final MinionStore minions;
    private final AdmissionThrottle throttle;
    private final CommandBackend backend;
    private final Executor submitExecutor;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final int outputMaxBytes;
    private final long defaultTimeoutMs;
    private final AtomicLong submitFailures = new AtomicLong();
    private final AtomicLong watchdogTimeouts = new AtomicLong();

    public CommandDispatcher(
            CommandStore store,
            MinionStore minions,
            AdmissionThrottle throttle,
            CommandBackend backend,
            Executor submitExecutor,
            AuditLogger auditLogger,
            Clock clock,
            int outputMaxBytes,
            long defaultTimeoutMs
    ) {
        this.store = store;
        this.minions = minions;
        this.throttle = throttle;
        this.backend = backend;
        this.submitExecutor = submitExecutor;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.outputMaxBytes = Math.max(1, outputMaxBytes);
        this.defaultTimeoutMs = defaultTimeoutMs;
    }

    public CommandExecution dispatch(String clientKey, String targetMinionId, String payload, Duration timeout, String requestedBy) {
        throttle.acquire(EndpointClass.COMMAND_DISPATCH, clientKey, clock.millis());
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("payload must not be blank");
        }
        long timeoutMs = resolveTimeout(timeout);
        Optional<MinionIdentity> target = targetMinionId == null ? Optional.empty() : minions.find(targetMinionId.trim());
        if (target.isEmpty() || target.get().state() != TrustState.ACCEPTED) {
            throw new UnknownTargetException(targetMinionId);
        }
        String minionId = target.get().id();
        String executionId = UUID.randomUUID().toString();
        store.insertQueued(executionId, minionId, payload, timeoutMs, requestedBy, clock.millis());
        audit("command.dispatch", requestedBy, executionId, "queued", details(minionId, timeoutMs));
        try {
            submitExecutor.execute(() -> submit(executionId, minionId, payload, timeoutMs));
        } catch (RejectedExecutionException e) {
            failSubmission(executionId, "dispatcher is shutting down");
        }
        return get(executionId);
    }

    public void onBackendAck(String executionId) {
        if (store.tryMarkRunning(executionId, clock.millis())) {
            log.debug("Execution {} acknowledged by backend", executionId);
            audit("command.transition", "backend", executionId, CommandState.RUNNING.name(), Map.of());
            return;
        }
        log.debug("Ignored ack for execution {}: not QUEUED", executionId);
    }

    public void onBackendResult(String executionId, int exitCode, String output) {
        TruncatedOutput bounded = truncate(output, outputMaxBytes);
        CommandState terminal = exitCode == 0 ? CommandState.COMPLETED : CommandState.FAILED;
        if (store.tryFinishWithResult(executionId, terminal, exitCode, bounded.text(), bounded.truncated(), clock.millis())) {
            log.info("Execution {} finished: {} (exit {})", executionId, terminal, exitCode);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("exit_code", exitCode);
            details.put("output_truncated", bounded.truncated());
            audit("command.transition", "backend", executionId, terminal.name(), details);
            return;
        }
        log.debug("Ignored result for execution {}: already terminal or unknown", executionId);
    }

    /** Moves every overdue QUEUED/RUNNING execution to TIMED_OUT. Returns how many moved. */
    public int watchdogSweep(long nowMs) {
        int moved = 0;
        while (true) {
            List<String> overdue = store.listOverdue(nowMs, SWEEP_BATCH);
            int batchMoved = 0;
            for (String executionId : overdue) {
                if (store.tryMarkTimedOut(executionId, nowMs)) {
                    batchMoved++;
                    watchdogTimeouts.incrementAndGet();
                    log.warn("Execution {} timed out", executionId);
                    audit("command.transition", "watchdog", executionId, CommandState.TIMED_OUT.name(), Map.of());
                }
            }
            moved += batchMoved;
            if (overdue.size() < SWEEP_BATCH || batchMoved == 0) {
                return moved;
            }
        }
    }

    /**
     * Hands every active execution with a backend job id back to the backend for result
     * tracking. Returns how many were handed over.
     */
    public int resumeActive() {
        int resumed = 0;
        for (CommandExecution execution : store.listActiveSubmitted(SWEEP_BATCH)) {
            try {
                backend.resume(execution.targetMinionId(), new SubmissionHandle(execution.submissionHandle()),
                        execution.startedAtMs() + execution.timeoutMs(), new BoundCallback(execution.id()));
                resumed++;
            } catch (RuntimeException e) {
                log.warn("Could not resume execution {}: {}", execution.id(), e.getMessage());
            }
        }
        return resumed;
    }

    public CommandExecution get(String executionId) {
        return store.find(executionId)
                .orElseThrow(() -> new NotFoundException("Unknown command execution: " + executionId));
    }

    public List<CommandExecution> list(String targetMinionId, int limit) {
        return store.list(targetMinionId, limit);
    }

    /**
     * Waits until the execution is terminal or {@code maxWait} elapses and returns the latest
     * snapshot. An execution that ended TIMED_OUT raises {@link CommandTimeoutException}.
     */
    public CommandExecution await(String executionId, Duration maxWait) throws InterruptedException {
        long deadlineNanos = System.nanoTime() + Math.max(0L, maxWait.toNanos());
        CommandExecution current = get(executionId);
        while (!current.terminal() && System.nanoTime() - deadlineNanos < 0) {
            Thread.sleep(AWAIT_POLL_MS);
            current = get(executionId);
        }
        if (current.state() == CommandState.TIMED_OUT) {
            throw new CommandTimeoutException(executionId);
        }
        return current;
    }

    public long submitFailures() {
        return submitFailures.get();
    }

    public long watchdogTimeouts() {
        return watchdogTimeouts.get();
    }

    private void submit(String executionId, String minionId, String payload, long timeoutMs) {
        try {
            SubmissionHandle handle = backend.submit(minionId, payload, timeoutMs, new BoundCallback(executionId));
            if (handle != null && handle.value() != null) {
                store.recordSubmissionHandle(executionId, handle.value(), clock.millis());
            }
        } catch (RuntimeException e) {
            log.warn("Submission of execution {} to {} failed: {}", executionId, minionId, e.getMessage());
            failSubmission(executionId, "submission failed: " + e.getMessage());
        }
    }

    private void failSubmission(String executionId, String error) {
        submitFailures.incrementAndGet();
        if (store.tryFailQueued(executionId, error, clock.millis())) {
            audit("command.transition", "dispatcher", executionId, CommandState.FAILED.name(), Map.of("error", error));
        }
    }

    private long resolveTimeout(Duration timeout) {
        if (timeout == null) {
            return defaultTimeoutMs;
        }
        long ms;
        try {
            ms = timeout.toMillis();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("timeout is too large", e);
        }
        if (ms <= 0L) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        return Math.min(ms, FleetGateConfig.MAX_COMMAND_TIMEOUT_MS);
    }

    private void audit(String action, String actor, String executionId, String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        auditLogger.log(AuditLogger.AuditEvent.of(action, actor, "command:" + executionId, result, details));
    }

    private static Map<String, Object> details(String minionId, long timeoutMs) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("target", minionId);
        out.put("timeout_ms", timeoutMs);
        return out;
    }

    /** Cuts UTF-8 output at {@code maxBytes} without splitting a code point. */
    static TruncatedOutput truncate(String output, int maxBytes) {
        if (output == null) {
            return new TruncatedOutput(null, false);
        }
        byte[] bytes = output.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= maxBytes) {
            return new TruncatedOutput(output, false);
        }
        int cut = maxBytes;
        while (cut > 0 && (bytes[cut] & 0xC0) == 0x80) {
            cut--;
        }
        return new TruncatedOutput(new String(bytes, 0, cut, StandardCharsets.UTF_8), true);
    }

    record TruncatedOutput(String text, boolean truncated) {
    }

    private final class BoundCallback implements CommandCallback {
        private final String executionId;

        private BoundCallback(String executionId) {
            this.executionId = executionId;
        }

        @Override
        public void onAck() {
            onBackendAck(executionId);
        }

        @Override
        public void onResult(int exitCode, String output) {
            onBackendResult(executionId, exitCode, output);
        }
    }
}
