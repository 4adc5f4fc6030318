package io.fleetgate.model;

public record MinionIdentity(
        String id,
        String fingerprint,
        TrustState state,
        long firstSeenAtMs,
        Long decidedAtMs,
        String decidedBy
) {
}
