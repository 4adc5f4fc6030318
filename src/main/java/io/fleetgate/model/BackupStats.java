package io.fleetgate.model;

public record BackupStats(Long originalSize, Long compressedSize, Long deduplicatedSize, Long fileCount) {
    public static BackupStats empty() {
        return new BackupStats(null, null, null, null);
    }
}
