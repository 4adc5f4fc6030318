package io.fleetgate.error;

import io.fleetgate.model.TrustState;

public final class AlreadyDecidedException extends FleetGateException {
    private final TrustState currentState;

    public AlreadyDecidedException(String minionId, TrustState currentState) {
        super("already_decided", "Minion " + minionId + " is already decided or a decision is in flight (state=" + currentState + ")");
        this.currentState = currentState;
    }

    public TrustState currentState() {
        return currentState;
    }
}
