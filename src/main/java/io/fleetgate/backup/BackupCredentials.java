package io.fleetgate.backup;

import java.util.Arrays;

/** Repository passphrase held for the duration of one backup invocation and wiped on close. */
public final class BackupCredentials implements AutoCloseable {
    private final char[] passphrase;
    private volatile boolean closed;

    private BackupCredentials(char[] passphrase) {
        this.passphrase = passphrase;
    }

    public static BackupCredentials of(String passphrase) {
        if (passphrase == null || passphrase.isEmpty()) {
            throw new IllegalArgumentException("Backup passphrase is not configured");
        }
        return new BackupCredentials(passphrase.toCharArray());
    }

    public String passphrase() {
        if (closed) {
            throw new IllegalStateException("Backup credentials already released");
        }
        return new String(passphrase);
    }

    public boolean closed() {
        return closed;
    }

    @Override
    public void close() {
        Arrays.fill(passphrase, '\0');
        closed = true;
    }

    @Override
    public String toString() {
        return "BackupCredentials[***]";
    }
}
