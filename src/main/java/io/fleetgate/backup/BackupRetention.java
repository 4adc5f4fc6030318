package io.fleetgate.backup;

public record BackupRetention(int daily, int weekly, int monthly) {
    public static final int MAX_KEEP = 1000;

    public BackupRetention {
        requireRange("daily", daily);
        requireRange("weekly", weekly);
        requireRange("monthly", monthly);
    }

    private static void requireRange(String name, int value) {
        if (value < 0 || value > MAX_KEEP) {
            throw new IllegalArgumentException("Invalid retention count for " + name + ": " + value);
        }
    }
}
