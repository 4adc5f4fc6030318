package io.fleetgate.error;

public final class CommandTimeoutException extends FleetGateException {
    private final String executionId;

    public CommandTimeoutException(String executionId) {
        super("timed_out", "Command execution timed out: " + executionId);
        this.executionId = executionId;
    }

    public String executionId() {
        return executionId;
    }
}
