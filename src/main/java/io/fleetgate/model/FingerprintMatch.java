package io.fleetgate.model;

public enum FingerprintMatch {
    MATCH,
    MISMATCH,
    UNKNOWN
}
