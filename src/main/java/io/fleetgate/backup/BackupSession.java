package io.fleetgate.backup;

import java.nio.file.Path;

/**
 * Secrets and target for one orchestrator invocation. {@code keyFile} is null when the target
 * needs no transport key.
 */
public record BackupSession(String repositoryTarget, BackupCredentials credentials, Path keyFile) {
    @Override
    public String toString() {
        return "BackupSession[target=" + repositoryTarget + ", keyFile=" + (keyFile == null ? "<none>" : keyFile.getFileName()) + "]";
    }
}
