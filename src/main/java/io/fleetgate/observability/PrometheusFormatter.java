package io.fleetgate.observability;

import io.fleetgate.runtime.FleetGateRuntime;

import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(FleetGateRuntime.StatsOutcome stats) {
        StringBuilder sb = new StringBuilder();
        appendMapGauge(sb, "fleetgate_minions_total", "Minion identities grouped by trust state", "state", stats.minionsByState());
        appendMapGauge(sb, "fleetgate_command_executions_total", "Command executions grouped by state", "state", stats.commandsByState());
        appendMapGauge(sb, "fleetgate_backup_runs_total", "Backup runs grouped by outcome", "outcome", stats.backupRunsByOutcome());
        appendMapGauge(sb, "fleetgate_throttle_denied_total", "Calls denied by the admission throttle since start", "endpoint_class", stats.throttleDeniedByClass());
        appendGauge(sb, "fleetgate_throttle_tracked_keys", "Client keys currently tracked by the admission throttle", null, null, stats.throttleTrackedKeys());
        appendGauge(sb, "fleetgate_command_watchdog_timeouts_total", "Executions moved to TIMED_OUT by the watchdog since start", null, null, stats.watchdogTimeoutsTotal());
        appendGauge(sb, "fleetgate_command_submit_failures_total", "Command submissions rejected by the backend since start", null, null, stats.submitFailuresTotal());
        appendGauge(sb, "fleetgate_backup_last_finished_timestamp_ms", "Finish time of the latest backup run (0 when none)", null, null, stats.lastBackupFinishedAtMs());
        appendGauge(sb, "fleetgate_backup_last_success", "Whether the latest backup run succeeded (1=yes,0=no)", null, null, stats.lastBackupSucceeded());
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, ? extends Number> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, ? extends Number> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue().longValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
