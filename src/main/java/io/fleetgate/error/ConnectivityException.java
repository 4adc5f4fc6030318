package io.fleetgate.error;

public final class ConnectivityException extends FleetGateException {
    public ConnectivityException(String message) {
        super("backend_unavailable", message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super("backend_unavailable", message, cause);
    }
}
