package io.fleetgate.error;

public final class NotFoundException extends FleetGateException {
    public NotFoundException(String message) {
        super("not_found", message);
    }
}
