package io.fleetgate.config;

import java.util.List;

/**
 * Backup job configuration. Passed explicitly into each orchestrator invocation; the passphrase
 * and SSH key never appear in {@link #toString()}.
 */
public record BackupSettings(
        boolean enabled,
        String repositoryTarget,
        String passphrase,
        String sshKey,
        long intervalMs,
        String borgBinary,
        List<String> sourcePaths,
        String archivePrefix,
        int retentionDaily,
        int retentionWeekly,
        int retentionMonthly
) {
    public BackupSettings {
        sourcePaths = sourcePaths == null ? List.of() : List.copyOf(sourcePaths);
    }

    public static BackupSettings disabled() {
        return new BackupSettings(
                false,
                "",
                "",
                "",
                FleetGateConfig.DEFAULT_BACKUP_INTERVAL_MS,
                "borg",
                List.of(),
                "fleetgate",
                7,
                4,
                6
        );
    }

    public boolean hasSshKey() {
        return sshKey != null && !sshKey.isBlank();
    }

    @Override
    public String toString() {
        return "BackupSettings[enabled=" + enabled
                + ", repositoryTarget=" + maskTarget(repositoryTarget)
                + ", passphrase=" + (passphrase == null || passphrase.isEmpty() ? "<unset>" : "***")
                + ", sshKey=" + (hasSshKey() ? "***" : "<unset>")
                + ", intervalMs=" + intervalMs
                + ", borgBinary=" + borgBinary
                + ", sourcePaths=" + sourcePaths
                + ", archivePrefix=" + archivePrefix
                + ", retention=" + retentionDaily + "/" + retentionWeekly + "/" + retentionMonthly
                + "]";
    }

    /** Hides the user part of ssh://user@host style targets. */
    public static String maskTarget(String target) {
        if (target == null || target.isBlank()) {
            return "";
        }
        return target.replaceAll("ssh://[^@/]*@", "ssh://***@");
    }
}
