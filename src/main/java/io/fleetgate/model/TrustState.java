package io.fleetgate.model;

public enum TrustState {
    PENDING,
    ACCEPTED,
    REJECTED;

    public boolean decided() {
        return this != PENDING;
    }
}
