package io.fleetgate.backup;

import io.fleetgate.model.BackupStats;
import io.fleetgate.support.TestRoots;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.stream.Stream;

final class BorgBackupTransportTest {
    private static final String PASSPHRASE = "correct horse battery staple";

    @Test
    void modernExitCodesAreAuthoritative() {
        Assertions.assertEquals(ProbeStatus.EXISTS, BorgBackupTransport.classify(0, "does not exist"));
        Assertions.assertEquals(ProbeStatus.NOT_FOUND, BorgBackupTransport.classify(13, ""));
        Assertions.assertEquals(ProbeStatus.INVALID_REPOSITORY, BorgBackupTransport.classify(15, ""));
        Assertions.assertEquals(ProbeStatus.AUTH_ERROR, BorgBackupTransport.classify(51, ""));
        Assertions.assertEquals(ProbeStatus.AUTH_ERROR, BorgBackupTransport.classify(52, "does not exist"));
        Assertions.assertEquals(ProbeStatus.NETWORK_ERROR, BorgBackupTransport.classify(80, ""));
        Assertions.assertEquals(ProbeStatus.NETWORK_ERROR, BorgBackupTransport.classify(83, ""));
    }

    @Test
    void legacyExitCodeFallsBackToOutputText() {
        Assertions.assertEquals(ProbeStatus.NOT_FOUND,
                BorgBackupTransport.classify(2, "Repository ssh://host/./fleet does not exist."));
        Assertions.assertEquals(ProbeStatus.INVALID_REPOSITORY,
                BorgBackupTransport.classify(2, "/srv/x is not a valid repository. Check repo config."));
        Assertions.assertEquals(ProbeStatus.AUTH_ERROR,
                BorgBackupTransport.classify(2, "passphrase supplied in BORG_PASSPHRASE is incorrect."));
        Assertions.assertEquals(ProbeStatus.AUTH_ERROR,
                BorgBackupTransport.classify(2, "Remote: Permission denied (publickey)."));
        Assertions.assertEquals(ProbeStatus.NETWORK_ERROR,
                BorgBackupTransport.classify(2, "Connection closed by remote host"));
        Assertions.assertEquals(ProbeStatus.NETWORK_ERROR, BorgBackupTransport.classify(-1, null));
    }

    @Test
    void statsAreReadFromCreateOutput() {
        String output = """
                ------------------------------------------------------------------------------
                Archive name: fleetgate-2025-10-09_08-53-20
                Number of files: 1532
                                       Original size      Compressed size    Deduplicated size
                This archive:
                Original size: 104857600
                Compressed size: 52428800
                Deduplicated size: 1048576
                """;
        BackupStats stats = BorgBackupTransport.parseStats(output);
        Assertions.assertEquals(104_857_600L, stats.originalSize());
        Assertions.assertEquals(52_428_800L, stats.compressedSize());
        Assertions.assertEquals(1_048_576L, stats.deduplicatedSize());
        Assertions.assertEquals(1532L, stats.fileCount());

        BackupStats none = BorgBackupTransport.parseStats("nothing useful");
        Assertions.assertNull(none.originalSize());
        Assertions.assertNull(none.fileCount());
        Assertions.assertNull(BorgBackupTransport.parseStats(null).compressedSize());
    }

    @Test
    void drivesBorgBinaryThroughEnvironment() throws Exception {
        Assumptions.assumeTrue(Files.isExecutable(Path.of("/bin/sh")));
        Path root = Files.createTempDirectory("fleetgate-test-borg-");
        Assumptions.assumeTrue(root.getFileSystem().supportedFileAttributeViews().contains("posix"));
        try {
            Path state = Files.createDirectories(root.resolve("state"));
            Path borg = root.resolve("borg");
            Files.writeString(borg, fakeBorg(state), StandardCharsets.UTF_8);
            Files.setPosixFilePermissions(borg, PosixFilePermissions.fromString("rwx------"));
            Path source = Files.createDirectories(root.resolve("source"));
            BorgBackupTransport transport = new BorgBackupTransport(borg.toString(), 10_000L, root.resolve("work"));

            try (BackupCredentials credentials = BackupCredentials.of(PASSPHRASE)) {
                BackupSession session = new BackupSession("/srv/backups/fleet", credentials, null);
                ProbeResult missing = transport.probe(session);
                Assertions.assertEquals(ProbeStatus.NOT_FOUND, missing.status());
                Assertions.assertTrue(missing.detail().startsWith("exit=13"), missing.detail());

                Assertions.assertTrue(transport.initialize(session).success());
                Assertions.assertEquals(ProbeStatus.EXISTS, transport.probe(session).status());

                TransportResult run = transport.run(session, "fleetgate-test", List.of(source));
                Assertions.assertTrue(run.success(), run.detail());
                Assertions.assertEquals(1000L, run.stats().originalSize());
                Assertions.assertEquals(3L, run.stats().fileCount());
                String args = Files.readString(state.resolve("create-args"), StandardCharsets.UTF_8);
                Assertions.assertTrue(args.contains("::fleetgate-test"), args);
                Assertions.assertTrue(args.contains(source.toString()), args);

                TransportResult prune = transport.prune(session, new BackupRetention(7, 4, 6));
                Assertions.assertTrue(prune.success());
                Assertions.assertTrue(Files.readString(state.resolve("prune-args")).contains("--keep-weekly=4"));
            }
            try (BackupCredentials wrong = BackupCredentials.of("not-the-passphrase")) {
                ProbeResult denied = transport.probe(new BackupSession("/srv/backups/fleet", wrong, null));
                Assertions.assertEquals(ProbeStatus.AUTH_ERROR, denied.status());
            }
            try (Stream<Path> leftovers = Files.list(root.resolve("work"))) {
                Assertions.assertEquals(0, leftovers.count());
            }
        } finally {
            TestRoots.deleteRecursively(root);
        }
    }

    @Test
    void missingBinaryIsReportedAsFailure() throws Exception {
        Path root = Files.createTempDirectory("fleetgate-test-borg-missing-");
        try {
            BorgBackupTransport transport = new BorgBackupTransport(
                    root.resolve("no-such-borg").toString(), 5_000L, root.resolve("work"));
            try (BackupCredentials credentials = BackupCredentials.of(PASSPHRASE)) {
                ProbeResult probe = transport.probe(new BackupSession("/srv/backups/fleet", credentials, null));
                Assertions.assertEquals(ProbeStatus.NETWORK_ERROR, probe.status());
                Assertions.assertTrue(probe.detail().contains("could not run"), probe.detail());
                Assertions.assertFalse(probe.detail().contains(PASSPHRASE));
            }
        } finally {
            TestRoots.deleteRecursively(root);
        }
        Assertions.assertThrows(IllegalArgumentException.class, () -> new BorgBackupTransport(" ", 1_000L, root));
    }

    private static String fakeBorg(Path state) {
        return """
                #!/bin/sh
                STATE='%s'
                case "$1" in
                  list)
                    if [ ! -f "$STATE/initialized" ]; then
                      echo "Repository $BORG_REPO does not exist."
                      exit 13
                    fi
                    if [ "$BORG_PASSPHRASE" != "%s" ]; then
                      echo "passphrase supplied in BORG_PASSPHRASE is incorrect."
                      exit 52
                    fi
                    exit 0
                    ;;
                  init)
                    touch "$STATE/initialized"
                    exit 0
                    ;;
                  create)
                    echo "$@" > "$STATE/create-args"
                    echo "Number of files: 3"
                    echo "Original size: 1000"
                    echo "Compressed size: 600"
                    echo "Deduplicated size: 200"
                    exit 0
                    ;;
                  prune)
                    echo "$@" > "$STATE/prune-args"
                    exit 0
                    ;;
                esac
                exit 2
                """.formatted(state, PASSPHRASE);
    }
}
