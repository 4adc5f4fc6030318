package io.fleetgate.cli;

import io.fleetgate.config.FleetGateConfig;
import io.fleetgate.error.FleetGateException;
import io.fleetgate.model.BackupOutcome;
import io.fleetgate.model.BackupRun;
import io.fleetgate.model.CommandExecution;
import io.fleetgate.model.TrustState;
import io.fleetgate.observability.AuditLogger;
import io.fleetgate.runtime.FleetGateRuntime;
import io.fleetgate.security.OperatorAuth;
import io.fleetgate.security.OperatorPrincipal;
import io.fleetgate.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "fleetgate",
        mixinStandardHelpOptions = true,
        description = "FleetGate fleet trust and command orchestration CLI",
        subcommands = {
                FleetGateCommand.InitCommand.class,
                FleetGateCommand.HandshakeCommand.class,
                FleetGateCommand.DecideCommand.class,
                FleetGateCommand.MinionsCommand.class,
                FleetGateCommand.MinionCommand.class,
                FleetGateCommand.DispatchCommand.class,
                FleetGateCommand.CommandStatusCommand.class,
                FleetGateCommand.CommandsCommand.class,
                FleetGateCommand.WatchdogCommand.class,
                FleetGateCommand.BackupRunCommand.class,
                FleetGateCommand.BackupLastCommand.class,
                FleetGateCommand.StatsCommand.class,
                FleetGateCommand.MetricsCommand.class,
                FleetGateCommand.HealthCommand.class,
                FleetGateCommand.AuditTailCommand.class,
                FleetGateCommand.AuditVerifyCommand.class,
                FleetGateCommand.ServeApiCommand.class
        }
)
public final class FleetGateCommand implements Runnable {
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CONFLICT = 3;
    static final int EXIT_NOT_FOUND = 4;
    static final int EXIT_THROTTLED = 5;
    static final int EXIT_BACKEND = 6;

    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | handshake | decide | minions | minion | dispatch | command | commands | watchdog | backup-run | backup-last | stats | metrics | health | audit-tail | audit-verify | serve-api");
    }

    /** Command line with the error mapping every entry point uses. */
    public static CommandLine commandLine() {
        CommandLine cli = new CommandLine(new FleetGateCommand());
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            commandLine.getErr().println("error: " + describe(ex));
            return exitCodeFor(ex);
        });
        return cli;
    }

    static int exitCodeFor(Exception ex) {
        if (!(ex instanceof FleetGateException fleet)) {
            return EXIT_FAILURE;
        }
        return switch (fleet.code()) {
            case "fingerprint_mismatch", "already_decided" -> EXIT_CONFLICT;
            case "not_found", "unknown_target" -> EXIT_NOT_FOUND;
            case "rate_limited" -> EXIT_THROTTLED;
            case "backend_unavailable", "timed_out" -> EXIT_BACKEND;
            default -> EXIT_FAILURE;
        };
    }

    private static String describe(Exception ex) {
        if (ex instanceof FleetGateException fleet) {
            return fleet.code() + ": " + fleet.getMessage();
        }
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }

    FleetGateConfig config() {
        return FleetGateConfig.fromRoot(root);
    }

    FleetGateRuntime runtime() {
        FleetGateRuntime runtime = new FleetGateRuntime(config());
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Initialize directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        FleetGateCommand parent;

        @Override
        public Integer call() {
            try (FleetGateRuntime runtime = parent.runtime()) {
                System.out.println("Initialized FleetGate at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "handshake", description = "Record a minion handshake (PENDING until decided)")
    static final class HandshakeCommand implements Callable<Integer> {
        @ParentCommand
        FleetGateCommand parent;

        @Option(names = {"--id"}, required = true, description = "Minion id")
        String minionId;

        @Option(names = {"--fingerprint"}, required = true, description = "Key fingerprint presented by the minion")
        String fingerprint;

        @Override
        public Integer call() {
            try (FleetGateRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.handshake("local", minionId, fingerprint)));
            }
            return 0;
        }
    }

    @Command(name = "decide", description = "Accept or reject a pending minion")
    static final class DecideCommand implements Callable<Integer> {
        @ParentCommand
        FleetGateCommand parent;

        @Parameters(index = "0", description = "Minion id")
        String minionId;

        @Parameters(index = "1", description = "Decision: accept|reject")
        String decision;

        @Option(names = {"--fingerprint"}, description = "Fingerprint the operator confirmed (required for accept)")
        String fingerprint;

        @Override
        public Integer call() {
            try (FleetGateRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(
                        runtime.decide(OperatorPrincipal.localAdmin(), "local", minionId, decision, fingerprint)));
            }
            return 0;
        }
    }

    @Command(name = "minions", description = "List minion identities")
    static final class MinionsCommand implements Callable<Integer> {
        @ParentCommand
        FleetGateCommand parent;

        @Option(names = {"--state"}, description = "Filter by state: pending|accepted|rejected")
        String state;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            TrustState filter = state == null || state.isBlank() ? null : TrustState.valueOf(state.trim().toUpperCase(Locale.ROOT));
            try (FleetGateRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.minions(OperatorPrincipal.localAdmin(), filter, limit)));
            }
            return 0;
        }
    }

    @Command(name = "minion", description = "Show one minion identity")
    static final class MinionCommand implements Callable<Integer> {
        @ParentCommand
        FleetGateCommand parent;

        @Parameters(index = "0", description = "Minion id")
        String minionId;

        @Override
        public Integer call() {
            try (FleetGateRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.minion(OperatorPrincipal.localAdmin(), minionId)));
            }
            return 0;
        }
    }

    @Command(name = "dispatch", description = "Dispatch a shell command to an accepted minion")
    static final class DispatchCommand implements Callable<Integer> {
        @ParentCommand
        FleetGateCommand parent;

        @Option(names = {"--target"}, required = true, description = "Target minion id")
        String target;

        @Option(names = {"--payload"}, required = true, description = "Command to run")
        String payload;

        @Option(names = {"--timeout-seconds"}, description = "Execution timeout (default from settings)")
        Long timeoutSeconds;

        @Option(names = {"--wait"}, defaultValue = "false", description = "Wait for a terminal state, sweeping the watchdog meanwhile. Without it, a running serve-api picks up the result")
        boolean waitForResult;

        @Override
        public Integer call() throws InterruptedException {
            try (FleetGateRuntime runtime = parent.runtime()) {
                OperatorPrincipal principal = OperatorPrincipal.localAdmin();
                Duration timeout = timeoutSeconds == null ? null : Duration.ofSeconds(timeoutSeconds);
                CommandExecution execution = runtime.dispatch(principal, target, payload, timeout);
                if (waitForResult) {
                    runtime.startWatchdog();
                    execution = runtime.awaitCommand(principal, execution.id(),
                            Duration.ofMillis(execution.timeoutMs()).plusSeconds(30));
                }
                System.out.println(Jsons.toJson(execution));
                return execution.terminal() && execution.exitCode() != null && execution.exitCode() != 0 ? EXIT_FAILURE : 0;
            }
        }
    }

    @Command(name = "command", description = "Show a command execution snapshot")
    static final class CommandStatusCommand implements Callable<Integer> {
        @ParentCommand
        FleetGateCommand parent;

        @Parameters(index = "0", description = "Execution id")
        String executionId;

        @Override
        public Integer call() {
            try (FleetGateRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.command(OperatorPrincipal.localAdmin(), executionId)));
            }
            return 0;
        }
    }

    @Command(name = "commands", description = "List recent command executions")
    static final class CommandsCommand implements Callable<Integer> {
        @ParentCommand
        FleetGateCommand parent;

        @Option(names = {"--target"}, description = "Filter by target minion id")
        String target;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            try (FleetGateRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.commands(OperatorPrincipal.localAdmin(), target, limit)));
            }
            return 0;
        }
    }

    @Command(name = "watchdog", description = "Run one watchdog sweep over overdue executions")
    static final class WatchdogCommand implements Callable<Integer> {
        @ParentCommand
        FleetGateCommand parent;

        @Override
        public Integer call() {
            try (FleetGateRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(Map.of("timedOut", runtime.watchdogSweep())));
            }
            return 0;
        }
    }

    @Command(name = "backup-run", description = "Run the backup job now (skipped when one is in flight)")
    static final class BackupRunCommand implements Callable<Integer> {
        @ParentCommand
        FleetGateCommand parent;

        @Override
        public Integer call() {
            try (FleetGateRuntime runtime = parent.runtime()) {
                Optional<BackupRun> run = runtime.triggerBackup(OperatorPrincipal.localAdmin());
                if (run.isEmpty()) {
                    System.out.println(Jsons.toJson(Map.of("status", "skipped")));
                    return 0;
                }
                System.out.println(Jsons.toJson(run.get()));
                return run.get().outcome() == BackupOutcome.FAILED ? EXIT_FAILURE : 0;
            }
        }
    }

    @Command(name = "backup-last", description = "Show the latest backup run")
    static final class BackupLastCommand implements Callable<Integer> {
        @ParentCommand
        FleetGateCommand parent;

        @Override
        public Integer call() {
            try (FleetGateRuntime runtime = parent.runtime()) {
                Optional<BackupRun> run = runtime.lastBackupRun(OperatorPrincipal.localAdmin());
                if (run.isEmpty()) {
                    System.out.println("{\"error\":\"no backup run recorded\"}");
                    return EXIT_NOT_FOUND;
                }
                System.out.println(Jsons.toJson(run.get()));
            }
            return 0;
        }
    }

    @Command(name = "stats", description = "Show runtime counters")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        FleetGateCommand parent;

        @Override
        public Integer call() {
            try (FleetGateRuntime runtime = parent.runtime()) {
                System.out.println(Jsons.toJson(runtime.stats()));
            }
            return 0;
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics text")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        FleetGateCommand parent;

        @Override
        public Integer call() {
            try (FleetGateRuntime runtime = parent.runtime()) {
                System.out.print(runtime.metricsText());
            }
            return 0;
        }
    }

    @Command(name = "health", description = "Check runtime health")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        FleetGateCommand parent;

        @Override
        public Integer call() {
            try (FleetGateRuntime runtime = parent.runtime()) {
                FleetGateRuntime.HealthOutcome health = runtime.health();
                System.out.println(Jsons.toJson(health));
                return "ok".equals(health.status()) ? 0 : EXIT_FAILURE;
            }
        }
    }

    @Command(name = "audit-tail", description = "Show latest audit log rows")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        FleetGateCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest rows")
        int lines;

        @Override
        public Integer call() {
            try (FleetGateRuntime runtime = parent.runtime()) {
                var rows = runtime.auditTail(lines);
                for (var row : rows) {
                    System.out.println(Jsons.toCompactJson(row));
                }
            }
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit log hash chain and signatures")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        FleetGateCommand parent;

        @Override
        public Integer call() {
            try (FleetGateRuntime runtime = parent.runtime()) {
                AuditLogger.Verification verification = runtime.auditVerify();
                System.out.println(Jsons.toJson(verification));
                return verification.valid() ? 0 : EXIT_FAILURE;
            }
        }
    }

    @Command(name = "serve-api", description = "Run the HTTP API with the command watchdog and backup scheduler")
    static final class ServeApiCommand implements Callable<Integer> {
        @ParentCommand
        FleetGateCommand parent;

        @Option(names = {"--host"}, defaultValue = "127.0.0.1", description = "Bind address")
        String host;

        @Option(names = {"--port"}, defaultValue = "8080", description = "Bind port")
        int port;

        @Option(names = {"--auth-file"}, description = "JSON auth file (defaults to <root>/auth.json)")
        String authFile;

        @Override
        public Integer call() throws Exception {
            FleetGateConfig config = parent.config();
            OperatorAuth auth = OperatorAuth.load(authFile == null || authFile.isBlank()
                    ? config.authFile()
                    : Path.of(authFile));
            CountDownLatch stopped = new CountDownLatch(1);
            try (FleetGateRuntime runtime = parent.runtime();
                 FleetApiServer server = new FleetApiServer(runtime, auth)) {
                runtime.startBackgroundTasks();
                int bound = server.start(host, port);
                Runtime.getRuntime().addShutdownHook(new Thread(stopped::countDown, "fleetgate-shutdown"));
                System.out.println("FleetGate API listening on http://" + host + ":" + bound);
                stopped.await();
            }
            return 0;
        }
    }
}
