package io.fleetgate.support;

import io.fleetgate.backup.BackupRetention;
import io.fleetgate.backup.BackupSession;
import io.fleetgate.backup.BackupTransport;
import io.fleetgate.backup.ProbeResult;
import io.fleetgate.backup.ProbeStatus;
import io.fleetgate.backup.TransportResult;
import io.fleetgate.model.BackupStats;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Repository simulation: a target exists once initialized, and only the configured passphrase
 * opens it. Records every call, and whether the session's key file existed at that moment.
 */
public final class FakeBackupTransport implements BackupTransport {
    private final String expectedPassphrase;
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final List<Path> keyFilesSeen = new CopyOnWriteArrayList<>();
    private volatile boolean repositoryExists;
    private volatile ProbeStatus forcedProbe;
    private volatile CountDownLatch runGate;
    private volatile CountDownLatch runEntered;

    public FakeBackupTransport(String expectedPassphrase) {
        this.expectedPassphrase = expectedPassphrase;
    }

    public void setRepositoryExists(boolean exists) {
        this.repositoryExists = exists;
    }

    public void forceProbe(ProbeStatus status) {
        this.forcedProbe = status;
    }

    /** Makes {@link #run} block until {@code gate} opens, signalling {@code entered} first. */
    public void blockRuns(CountDownLatch entered, CountDownLatch gate) {
        this.runEntered = entered;
        this.runGate = gate;
    }

    public List<String> calls() {
        return List.copyOf(calls);
    }

    public List<Path> keyFilesSeen() {
        return List.copyOf(keyFilesSeen);
    }

    @Override
    public ProbeResult probe(BackupSession session) {
        calls.add("probe");
        recordKeyFile(session);
        if (forcedProbe != null) {
            return new ProbeResult(forcedProbe, "forced " + forcedProbe);
        }
        if (!repositoryExists) {
            return new ProbeResult(ProbeStatus.NOT_FOUND, "Repository " + session.repositoryTarget() + " does not exist.");
        }
        if (!expectedPassphrase.equals(session.credentials().passphrase())) {
            return new ProbeResult(ProbeStatus.AUTH_ERROR,
                    "passphrase supplied in BORG_PASSPHRASE is incorrect: " + session.credentials().passphrase());
        }
        return new ProbeResult(ProbeStatus.EXISTS, "");
    }

    @Override
    public TransportResult initialize(BackupSession session) {
        calls.add("init");
        recordKeyFile(session);
        repositoryExists = true;
        return TransportResult.ok();
    }

    @Override
    public TransportResult run(BackupSession session, String archiveName, List<Path> sources) {
        calls.add("create:" + archiveName);
        recordKeyFile(session);
        CountDownLatch entered = runEntered;
        CountDownLatch gate = runGate;
        if (entered != null) {
            entered.countDown();
        }
        if (gate != null) {
            try {
                if (!gate.await(10, TimeUnit.SECONDS)) {
                    return TransportResult.failed("test gate never opened");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return TransportResult.failed("interrupted");
            }
        }
        return TransportResult.ok(new BackupStats(2048L, 1024L, 512L, (long) sources.size()));
    }

    @Override
    public TransportResult prune(BackupSession session, BackupRetention retention) {
        calls.add("prune:" + retention.daily() + "/" + retention.weekly() + "/" + retention.monthly());
        return TransportResult.ok();
    }

    private void recordKeyFile(BackupSession session) {
        if (session.keyFile() != null && Files.exists(session.keyFile())) {
            keyFilesSeen.add(session.keyFile());
        }
    }
}
