package io.fleetgate.error;

/**
 * Root of the runtime's error taxonomy. Each subtype carries a stable {@link #code()} that the
 * HTTP layer and CLI report verbatim, so operators can tell e.g. a fingerprint mismatch from a
 * lost decision race.
 */
public abstract class FleetGateException extends RuntimeException {
    private final String code;

    protected FleetGateException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected FleetGateException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
