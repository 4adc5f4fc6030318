package io.fleetgate.storage;

import io.fleetgate.config.FleetGateConfig;
import io.fleetgate.model.BackupOutcome;
import io.fleetgate.model.CommandExecution;
import io.fleetgate.model.CommandState;
import io.fleetgate.model.TrustState;
import io.fleetgate.support.TestRoots;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class StoreTransitionsTest {
    @Test
    void schemaInitIsIdempotentAndRecordsMigrations() throws Exception {
        Path root = Files.createTempDirectory("fleetgate-test-schema-");
        try {
            Database db = new Database(FleetGateConfig.fromRoot(root.toString()));
            db.init();
            db.init();
            Assertions.assertEquals(2, db.listSchemaMigrations().size());
            Assertions.assertTrue(db.listSchemaMigrations().stream().allMatch(Database.SchemaMigrationRow::success));
            Assertions.assertTrue(Files.isDirectory(root.resolve("secrets")));
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    @Test
    void terminalCommandRowsNeverChangeAgain() throws Exception {
        Path root = Files.createTempDirectory("fleetgate-test-command-store-");
        try {
            CommandStore store = new CommandStore(init(root));
            store.insertQueued("exec-1", "web-01", "uptime", 1_000L, "alice", 100L);
            Assertions.assertTrue(store.tryMarkRunning("exec-1", 110L));
            Assertions.assertFalse(store.tryMarkRunning("exec-1", 120L));
            Assertions.assertFalse(store.tryMarkTimedOut("exec-1", 1_100L));

            Assertions.assertTrue(store.tryFinishWithResult("exec-1", CommandState.COMPLETED, 0, "ok", false, 900L));
            Assertions.assertFalse(store.tryFinishWithResult("exec-1", CommandState.FAILED, 1, "late", false, 950L));
            Assertions.assertFalse(store.tryMarkTimedOut("exec-1", 5_000L));
            Assertions.assertFalse(store.tryFailQueued("exec-1", "boom", 5_000L));

            CommandExecution done = store.find("exec-1").orElseThrow();
            Assertions.assertEquals(CommandState.COMPLETED, done.state());
            Assertions.assertEquals(110L, done.acknowledgedAtMs());
            Assertions.assertEquals(900L, done.finishedAtMs());
            Assertions.assertEquals("ok", done.output());

            store.insertQueued("exec-2", "web-01", "sleep 60", 1_000L, "alice", 200L);
            Assertions.assertTrue(store.listOverdue(1_100L, 10).isEmpty());
            Assertions.assertEquals(List.of("exec-2"), store.listOverdue(1_201L, 10));
            Assertions.assertTrue(store.tryMarkTimedOut("exec-2", 1_201L));
            Assertions.assertEquals(CommandState.TIMED_OUT, store.find("exec-2").orElseThrow().state());
            Assertions.assertEquals(1, store.countByState().get("TIMED_OUT"));
            Assertions.assertEquals(0, store.countByState().get("QUEUED"));
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    @Test
    void decisionClaimBlocksRejectUntilReleased() throws Exception {
        Path root = Files.createTempDirectory("fleetgate-test-minion-store-");
        try {
            MinionStore store = new MinionStore(init(root));
            Assertions.assertTrue(store.insertPendingIfAbsent("web-01", "aa:bb", 10L));
            Assertions.assertFalse(store.insertPendingIfAbsent("web-01", "cc:dd", 20L));

            Assertions.assertTrue(store.tryClaimDecision("web-01", "claim-1", 30L));
            Assertions.assertFalse(store.tryClaimDecision("web-01", "claim-2", 31L));
            Assertions.assertFalse(store.tryReject("web-01", "bob", 32L));
            Assertions.assertTrue(store.claimHeld("web-01"));

            Assertions.assertEquals(0, store.releaseStaleClaims(29L, 40L));
            Assertions.assertEquals(1, store.releaseStaleClaims(30L, 40L));
            Assertions.assertFalse(store.commitAccepted("web-01", "claim-1", "alice", 41L));
            Assertions.assertTrue(store.tryReject("web-01", "bob", 42L));
            Assertions.assertEquals(TrustState.REJECTED, store.find("web-01").orElseThrow().state());
            Assertions.assertEquals("aa:bb", store.find("web-01").orElseThrow().fingerprint());
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    @Test
    void oneUnfinishedBackupRunPerTarget() throws Exception {
        Path root = Files.createTempDirectory("fleetgate-test-backup-store-");
        try {
            BackupRunStore store = new BackupRunStore(init(root));
            Assertions.assertTrue(store.tryOpenRun("r1", "/srv/a", "manual", "fg-1", 10L));
            Assertions.assertFalse(store.tryOpenRun("r2", "/srv/a", "scheduled", "fg-2", 11L));
            Assertions.assertTrue(store.tryOpenRun("r3", "/srv/b", "scheduled", "fg-3", 12L));
            Assertions.assertEquals(2, store.countByOutcome().get("RUNNING"));

            Assertions.assertTrue(store.finishRun("r1", BackupOutcome.SUCCESS, null, null, 20L));
            Assertions.assertFalse(store.finishRun("r1", BackupOutcome.FAILED, "again", null, 21L));
            Assertions.assertTrue(store.tryOpenRun("r4", "/srv/a", "scheduled", "fg-4", 22L));
            Assertions.assertEquals("r4", store.latest("/srv/a").orElseThrow().id());
            Assertions.assertEquals(2, store.failUnfinished("process died", 30L));
            Assertions.assertEquals(2, store.countByOutcome().get("FAILED"));
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    private static Database init(Path root) {
        Database db = new Database(FleetGateConfig.fromRoot(root.toString()));
        db.init();
        return db;
    }
}
