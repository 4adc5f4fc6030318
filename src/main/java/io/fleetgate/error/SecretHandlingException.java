package io.fleetgate.error;

public final class SecretHandlingException extends FleetGateException {
    public SecretHandlingException(String message) {
        super("secret_handling", message);
    }

    public SecretHandlingException(String message, Throwable cause) {
        super("secret_handling", message, cause);
    }
}
