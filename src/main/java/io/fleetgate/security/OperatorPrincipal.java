package io.fleetgate.security;

import io.fleetgate.error.AccessDeniedException;

import java.util.Locale;

/** Authenticated caller of an operator-facing operation. The id is what audit rows record as actor. */
public record OperatorPrincipal(String id, OperatorRole role) {
    public OperatorPrincipal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("principal id must not be blank");
        }
        id = id.trim();
        role = role == null ? OperatorRole.VIEWER : role;
    }

    /** Used by local CLI invocations, which run with the data root owner's authority. */
    public static OperatorPrincipal localAdmin() {
        return new OperatorPrincipal("local:cli", OperatorRole.ADMIN);
    }

    public void require(Capability capability) {
        if (!role.grants(capability)) {
            throw new AccessDeniedException("Principal " + id + " (" + role.name().toLowerCase(Locale.ROOT)
                    + ") lacks capability " + capability.name().toLowerCase(Locale.ROOT));
        }
    }
}
