package io.fleetgate.error;

public final class ConflictException extends FleetGateException {
    public ConflictException(String message) {
        super("fingerprint_mismatch", message);
    }
}
