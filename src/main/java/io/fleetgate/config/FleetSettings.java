package io.fleetgate.config;

import io.fleetgate.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runtime settings read from {@code fleetgate-settings.json}. Every field is optional in the file;
 * missing or out-of-range values fall back to the defaults below.
 */
public record FleetSettings(
        long throttleWindowMs,
        int handshakeLimit,
        int trustDecisionLimit,
        int commandDispatchLimit,
        long defaultCommandTimeoutMs,
        int outputMaxBytes,
        long watchdogIntervalMs,
        long decisionClaimStaleMs,
        String saltApiUrl,
        String saltApiUsername,
        String saltApiPassword,
        String saltApiEauth,
        long saltPollIntervalMs,
        String auditSigningSecret,
        BackupSettings backup
) {
    public static FleetSettings defaults() {
        return new FleetSettings(
                FleetGateConfig.DEFAULT_THROTTLE_WINDOW_MS,
                FleetGateConfig.DEFAULT_HANDSHAKE_LIMIT,
                FleetGateConfig.DEFAULT_TRUST_DECISION_LIMIT,
                FleetGateConfig.DEFAULT_COMMAND_DISPATCH_LIMIT,
                FleetGateConfig.DEFAULT_COMMAND_TIMEOUT_MS,
                FleetGateConfig.DEFAULT_OUTPUT_MAX_BYTES,
                FleetGateConfig.DEFAULT_WATCHDOG_INTERVAL_MS,
                FleetGateConfig.DEFAULT_DECISION_CLAIM_STALE_MS,
                "http://localhost:8001",
                "saltapi",
                "",
                "pam",
                FleetGateConfig.DEFAULT_SALT_POLL_INTERVAL_MS,
                "",
                BackupSettings.disabled()
        );
    }

    public static FleetSettings load(Path file) {
        FleetSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(parsed, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + file, e);
        }
    }

    static FleetSettings fromFile(SettingsFile file, FleetSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long window = sanitizeLong(file.throttleWindowMs(), defaults.throttleWindowMs(), 1_000L);
        int handshake = sanitizeInt(file.handshakeLimit(), defaults.handshakeLimit(), 1);
        int decision = sanitizeInt(file.trustDecisionLimit(), defaults.trustDecisionLimit(), 1);
        int dispatch = sanitizeInt(file.commandDispatchLimit(), defaults.commandDispatchLimit(), 1);
        long timeout = sanitizeLong(file.defaultCommandTimeoutMs(), defaults.defaultCommandTimeoutMs(), 1_000L);
        if (timeout > FleetGateConfig.MAX_COMMAND_TIMEOUT_MS) {
            timeout = FleetGateConfig.MAX_COMMAND_TIMEOUT_MS;
        }
        int outputMax = sanitizeInt(file.outputMaxBytes(), defaults.outputMaxBytes(), 1_024);
        long watchdog = sanitizeLong(file.watchdogIntervalMs(), defaults.watchdogIntervalMs(), 100L);
        long claimStale = sanitizeLong(file.decisionClaimStaleMs(), defaults.decisionClaimStaleMs(), 1_000L);
        long saltPoll = sanitizeLong(file.saltPollIntervalMs(), defaults.saltPollIntervalMs(), 100L);
        return new FleetSettings(
                window,
                handshake,
                decision,
                dispatch,
                timeout,
                outputMax,
                watchdog,
                claimStale,
                sanitizeText(file.saltApiUrl(), defaults.saltApiUrl()),
                sanitizeText(file.saltApiUsername(), defaults.saltApiUsername()),
                file.saltApiPassword() == null ? defaults.saltApiPassword() : file.saltApiPassword(),
                sanitizeText(file.saltApiEauth(), defaults.saltApiEauth()),
                saltPoll,
                file.auditSigningSecret() == null ? defaults.auditSigningSecret() : file.auditSigningSecret().trim(),
                backupFromFile(file.backup(), defaults.backup())
        );
    }

    private static BackupSettings backupFromFile(BackupSettingsFile file, BackupSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new BackupSettings(
                file.enabled() != null ? file.enabled() : defaults.enabled(),
                sanitizeText(file.repositoryTarget(), defaults.repositoryTarget()),
                file.passphrase() == null ? defaults.passphrase() : file.passphrase(),
                file.sshKey() == null ? defaults.sshKey() : file.sshKey(),
                sanitizeLong(file.intervalMs(), defaults.intervalMs(), 60_000L),
                sanitizeText(file.borgBinary(), defaults.borgBinary()),
                file.sourcePaths() == null ? defaults.sourcePaths() : file.sourcePaths(),
                sanitizeText(file.archivePrefix(), defaults.archivePrefix()),
                sanitizeRetention(file.retentionDaily(), defaults.retentionDaily()),
                sanitizeRetention(file.retentionWeekly(), defaults.retentionWeekly()),
                sanitizeRetention(file.retentionMonthly(), defaults.retentionMonthly())
        );
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static int sanitizeRetention(Integer raw, int fallback) {
        if (raw == null || raw < 0 || raw > 1000) {
            return fallback;
        }
        return raw;
    }

    private static String sanitizeText(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    @Override
    public String toString() {
        return "FleetSettings[throttleWindowMs=" + throttleWindowMs
                + ", handshakeLimit=" + handshakeLimit
                + ", trustDecisionLimit=" + trustDecisionLimit
                + ", commandDispatchLimit=" + commandDispatchLimit
                + ", defaultCommandTimeoutMs=" + defaultCommandTimeoutMs
                + ", outputMaxBytes=" + outputMaxBytes
                + ", watchdogIntervalMs=" + watchdogIntervalMs
                + ", decisionClaimStaleMs=" + decisionClaimStaleMs
                + ", saltApiUrl=" + saltApiUrl
                + ", saltApiUsername=" + saltApiUsername
                + ", saltApiPassword=" + (saltApiPassword == null || saltApiPassword.isEmpty() ? "<unset>" : "***")
                + ", saltApiEauth=" + saltApiEauth
                + ", saltPollIntervalMs=" + saltPollIntervalMs
                + ", auditSigningSecret=" + (auditSigningSecret == null || auditSigningSecret.isEmpty() ? "<unset>" : "***")
                + ", backup=" + backup
                + "]";
    }

    record SettingsFile(
            Long throttleWindowMs,
            Integer handshakeLimit,
            Integer trustDecisionLimit,
            Integer commandDispatchLimit,
            Long defaultCommandTimeoutMs,
            Integer outputMaxBytes,
            Long watchdogIntervalMs,
            Long decisionClaimStaleMs,
            String saltApiUrl,
            String saltApiUsername,
            String saltApiPassword,
            String saltApiEauth,
            Long saltPollIntervalMs,
            String auditSigningSecret,
            BackupSettingsFile backup
    ) {
    }

    record BackupSettingsFile(
            Boolean enabled,
            String repositoryTarget,
            String passphrase,
            String sshKey,
            Long intervalMs,
            String borgBinary,
            List<String> sourcePaths,
            String archivePrefix,
            Integer retentionDaily,
            Integer retentionWeekly,
            Integer retentionMonthly
    ) {
    }
}
