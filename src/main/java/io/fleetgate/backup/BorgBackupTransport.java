package io.fleetgate.backup;

import io.fleetgate.model.BackupStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link BackupTransport} backed by the {@code borg} binary. Secrets reach the child process only
 * through its environment ({@code BORG_PASSPHRASE}, and {@code BORG_RSH} naming the key file),
 * never through the argument list.
 */
public final class BorgBackupTransport implements BackupTransport {
    private static final Logger log = LoggerFactory.getLogger(BorgBackupTransport.class);
    private static final int MAX_DETAIL_CHARS = 2_000;
    private static final Pattern ORIGINAL_SIZE = Pattern.compile("Original size:\\s+(\\d+)");
    private static final Pattern COMPRESSED_SIZE = Pattern.compile("Compressed size:\\s+(\\d+)");
    private static final Pattern DEDUPLICATED_SIZE = Pattern.compile("Deduplicated size:\\s+(\\d+)");
    private static final Pattern FILE_COUNT = Pattern.compile("Number of files:\\s+(\\d+)");

    private final String borgBinary;
    private final long commandTimeoutMs;
    private final Path workDir;

    public BorgBackupTransport(String borgBinary, long commandTimeoutMs, Path workDir) {
        if (borgBinary == null || borgBinary.isBlank()) {
            throw new IllegalArgumentException("borg binary cannot be empty");
        }
        this.borgBinary = borgBinary.trim();
        this.commandTimeoutMs = Math.max(1_000L, commandTimeoutMs);
        this.workDir = workDir;
    }

    @Override
    public ProbeResult probe(BackupSession session) {
        ProcessOutcome outcome = exec(session, List.of("list", "--last", "1"));
        ProbeStatus status = classify(outcome.exitCode(), outcome.output());
        return new ProbeResult(status, status == ProbeStatus.EXISTS ? "" : outcome.summary());
    }

    @Override
    public TransportResult initialize(BackupSession session) {
        ProcessOutcome outcome = exec(session, List.of("init", "--encryption=repokey"));
        return outcome.success() ? TransportResult.ok() : TransportResult.failed(outcome.summary());
    }

    @Override
    public TransportResult run(BackupSession session, String archiveName, List<Path> sources) {
        List<String> args = new ArrayList<>(List.of(
                "create", "--stats", "--compression", "lz4", "--exclude-caches", "::" + archiveName
        ));
        for (Path source : sources) {
            args.add(source.toString());
        }
        ProcessOutcome outcome = exec(session, args);
        if (!outcome.success()) {
            return TransportResult.failed(outcome.summary());
        }
        return TransportResult.ok(parseStats(outcome.output()));
    }

    @Override
    public TransportResult prune(BackupSession session, BackupRetention retention) {
        ProcessOutcome outcome = exec(session, List.of(
                "prune",
                "--keep-daily=" + retention.daily(),
                "--keep-weekly=" + retention.weekly(),
                "--keep-monthly=" + retention.monthly()
        ));
        return outcome.success() ? TransportResult.ok() : TransportResult.failed(outcome.summary());
    }

    /**
     * Maps a {@code borg list} outcome to a probe status. Modern exit codes are authoritative;
     * legacy code 2 falls back to matching the error text. Anything unrecognized counts as a
     * network error so that it never triggers initialization.
     */
    static ProbeStatus classify(int exitCode, String output) {
        if (exitCode == 0) {
            return ProbeStatus.EXISTS;
        }
        switch (exitCode) {
            case 13:
                return ProbeStatus.NOT_FOUND;
            case 15:
                return ProbeStatus.INVALID_REPOSITORY;
            case 51:
            case 52:
                return ProbeStatus.AUTH_ERROR;
            case 80:
            case 81:
            case 82:
            case 83:
                return ProbeStatus.NETWORK_ERROR;
            default:
                break;
        }
        String text = output == null ? "" : output.toLowerCase(Locale.ROOT);
        if (text.contains("does not exist")) {
            return ProbeStatus.NOT_FOUND;
        }
        if (text.contains("is not a valid repository")) {
            return ProbeStatus.INVALID_REPOSITORY;
        }
        if (text.contains("passphrase supplied") || text.contains("passphrase is incorrect")
                || text.contains("permission denied") || text.contains("authentication failed")) {
            return ProbeStatus.AUTH_ERROR;
        }
        return ProbeStatus.NETWORK_ERROR;
    }

    static BackupStats parseStats(String output) {
        return new BackupStats(
                firstLong(ORIGINAL_SIZE, output),
                firstLong(COMPRESSED_SIZE, output),
                firstLong(DEDUPLICATED_SIZE, output),
                firstLong(FILE_COUNT, output)
        );
    }

    private static Long firstLong(Pattern pattern, String text) {
        if (text == null) {
            return null;
        }
        Matcher m = pattern.matcher(text);
        return m.find() ? Long.parseLong(m.group(1)) : null;
    }

    private ProcessOutcome exec(BackupSession session, List<String> args) {
        List<String> command = new ArrayList<>();
        command.add(borgBinary);
        command.addAll(args);
        ProcessBuilder pb = new ProcessBuilder(command);
        Map<String, String> env = pb.environment();
        env.put("BORG_REPO", session.repositoryTarget());
        env.put("BORG_PASSPHRASE", session.credentials().passphrase());
        env.put("BORG_EXIT_CODES", "modern");
        env.put("BORG_RELOCATED_REPO_ACCESS_IS_OK", "no");
        env.put("BORG_UNKNOWN_UNENCRYPTED_REPO_ACCESS_IS_OK", "no");
        if (session.keyFile() != null) {
            env.put("BORG_RSH", "ssh -i " + session.keyFile().toAbsolutePath()
                    + " -o StrictHostKeyChecking=no -o UserKnownHostsFile=/dev/null -o LogLevel=ERROR");
        }
        pb.redirectErrorStream(true);
        Path outputFile = null;
        Process process = null;
        try {
            Files.createDirectories(workDir);
            outputFile = Files.createTempFile(workDir, "borg-", ".log");
            pb.redirectOutput(outputFile.toFile());
            process = pb.start();
            process.getOutputStream().close();
            boolean finished = process.waitFor(commandTimeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                return new ProcessOutcome(-1, "borg " + args.get(0) + " timeout after " + Duration.ofMillis(commandTimeoutMs));
            }
            String output = Files.readString(outputFile, StandardCharsets.UTF_8);
            return new ProcessOutcome(process.exitValue(), output);
        } catch (IOException e) {
            return new ProcessOutcome(-1, "borg " + args.get(0) + " could not run: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return new ProcessOutcome(-1, "borg " + args.get(0) + " interrupted");
        } finally {
            if (outputFile != null) {
                try {
                    Files.deleteIfExists(outputFile);
                } catch (IOException e) {
                    log.warn("Could not delete borg output file {}", outputFile.getFileName());
                }
            }
        }
    }

    private record ProcessOutcome(int exitCode, String output) {
        boolean success() {
            return exitCode == 0;
        }

        String summary() {
            String normalized = output == null ? "" : output.replace("\r", " ").replace("\n", " ").trim();
            if (normalized.length() > MAX_DETAIL_CHARS) {
                normalized = normalized.substring(0, MAX_DETAIL_CHARS) + "...";
            }
            return "exit=" + exitCode + " " + normalized;
        }
    }
}
