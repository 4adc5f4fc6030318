package io.fleetgate.error;

public final class AccessDeniedException extends FleetGateException {
    public AccessDeniedException(String message) {
        super("forbidden", message);
    }
}
