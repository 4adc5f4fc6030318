package io.fleetgate.security;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum OperatorRole {
    VIEWER(EnumSet.of(Capability.VIEW_FLEET)),
    OPERATOR(EnumSet.of(Capability.VIEW_FLEET, Capability.DECIDE_TRUST, Capability.DISPATCH_COMMAND)),
    ADMIN(EnumSet.allOf(Capability.class));

    private final Set<Capability> capabilities;

    OperatorRole(Set<Capability> capabilities) {
        this.capabilities = capabilities;
    }

    public boolean grants(Capability capability) {
        return capabilities.contains(capability);
    }

    public static OperatorRole parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return VIEWER;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "viewer", "read", "reader", "ro" -> VIEWER;
            case "operator", "write", "writer", "rw" -> OPERATOR;
            case "admin", "owner" -> ADMIN;
            default -> throw new IllegalArgumentException("Unsupported operator role: " + raw);
        };
    }
}
