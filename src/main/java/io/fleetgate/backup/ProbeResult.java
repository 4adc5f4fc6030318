package io.fleetgate.backup;

public record ProbeResult(ProbeStatus status, String detail) {
    public static ProbeResult of(ProbeStatus status) {
        return new ProbeResult(status, "");
    }
}
