package io.fleetgate.throttle;

import java.util.Locale;

/** Entry points guarded by the admission throttle. Each class keeps its own counters. */
public enum EndpointClass {
    HANDSHAKE,
    TRUST_DECISION,
    COMMAND_DISPATCH;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
