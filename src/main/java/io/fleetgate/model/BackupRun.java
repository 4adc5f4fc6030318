package io.fleetgate.model;

/**
 * One execution of the backup job. {@code outcome} and {@code finishedAtMs} stay null while
 * the run is in flight.
 */
public record BackupRun(
        String id,
        String repositoryTarget,
        String trigger,
        String archiveName,
        long startedAtMs,
        Long finishedAtMs,
        BackupOutcome outcome,
        String errorDetail,
        Long originalSize,
        Long compressedSize,
        Long deduplicatedSize,
        Long fileCount
) {
    public boolean finished() {
        return finishedAtMs != null;
    }
}
