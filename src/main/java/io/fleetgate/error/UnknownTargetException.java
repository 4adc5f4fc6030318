package io.fleetgate.error;

public final class UnknownTargetException extends FleetGateException {
    public UnknownTargetException(String targetMinionId) {
        super("unknown_target", "Target minion is unknown or not accepted: " + targetMinionId);
    }
}
