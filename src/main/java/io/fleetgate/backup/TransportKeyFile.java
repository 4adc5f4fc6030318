package io.fleetgate.backup;

import io.fleetgate.error.SecretHandlingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * SSH private key materialized to an owner-only file for the lifetime of one backup run.
 * {@link #close()} overwrites the content with zeros before deleting the file; any failure to do
 * so is a {@link SecretHandlingException}.
 */
public final class TransportKeyFile implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TransportKeyFile.class);
    static final String PREFIX = "transport-key-";
    static final String SUFFIX = ".key";
    private static final Pattern PRIVATE_KEY_HEADER = Pattern.compile("^-----BEGIN ([A-Z0-9]+ )*PRIVATE KEY-----");
    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final Path path;
    private boolean closed;

    private TransportKeyFile(Path path) {
        this.path = path;
    }

    public static TransportKeyFile materialize(Path directory, String keyContent) {
        String normalized = normalize(keyContent);
        Path file = null;
        try {
            Files.createDirectories(directory);
            file = createOwnerOnly(directory);
            Files.writeString(file, normalized, StandardCharsets.UTF_8,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
            return new TransportKeyFile(file);
        } catch (IOException | UnsupportedOperationException e) {
            if (file != null) {
                wipeQuietly(file);
            }
            throw new SecretHandlingException("Failed to materialize transport key in " + directory, e);
        }
    }

    /** Normalizes line endings and validates the key format. */
    static String normalize(String keyContent) {
        if (keyContent == null || keyContent.isBlank()) {
            throw new SecretHandlingException("Transport key is empty");
        }
        String normalized = keyContent.replace("\r\n", "\n").strip();
        if (!PRIVATE_KEY_HEADER.matcher(normalized).lookingAt() && !normalized.startsWith("ssh-")) {
            throw new SecretHandlingException("Invalid SSH key format");
        }
        return normalized + "\n";
    }

    public Path path() {
        if (closed) {
            throw new IllegalStateException("Transport key file already removed");
        }
        return path;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            wipe(path);
        } catch (IOException e) {
            throw new SecretHandlingException("Failed to remove transport key file " + path.getFileName(), e);
        }
    }

    /** Removes key files left behind by a process that died mid-run. Returns how many were removed. */
    public static int sweepStale(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, PREFIX + "*" + SUFFIX)) {
            for (Path file : stream) {
                wipe(file);
                removed++;
            }
        } catch (IOException e) {
            throw new SecretHandlingException("Failed to sweep stale transport keys in " + directory, e);
        }
        if (removed > 0) {
            log.warn("Removed {} stale transport key file(s) from {}", removed, directory);
        }
        return removed;
    }

    private static Path createOwnerOnly(Path directory) throws IOException {
        if (directory.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            FileAttribute<Set<PosixFilePermission>> attr = PosixFilePermissions.asFileAttribute(OWNER_ONLY);
            return Files.createTempFile(directory, PREFIX, SUFFIX, attr);
        }
        Path file = Files.createTempFile(directory, PREFIX, SUFFIX);
        File f = file.toFile();
        boolean restricted = f.setReadable(false, false) && f.setReadable(true, true)
                && f.setWritable(false, false) && f.setWritable(true, true);
        if (!restricted) {
            Files.deleteIfExists(file);
            throw new IOException("Cannot restrict permissions on " + file.getFileName());
        }
        return file;
    }

    private static void wipe(Path file) throws IOException {
        if (!Files.exists(file)) {
            return;
        }
        long size = Files.size(file);
        try (OutputStream out = Files.newOutputStream(file, StandardOpenOption.WRITE)) {
            byte[] zeros = new byte[4096];
            long remaining = Math.max(size, zeros.length);
            while (remaining > 0) {
                int n = (int) Math.min(zeros.length, remaining);
                out.write(zeros, 0, n);
                remaining -= n;
            }
        }
        Files.delete(file);
    }

    private static void wipeQuietly(Path file) {
        try {
            wipe(file);
        } catch (IOException e) {
            log.error("Could not remove partially written transport key {}", file.getFileName(), e);
        }
    }
}
