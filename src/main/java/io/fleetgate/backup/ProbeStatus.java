package io.fleetgate.backup;

/** Classified result of probing a repository target. Only NOT_FOUND may lead to initialization. */
public enum ProbeStatus {
    EXISTS,
    NOT_FOUND,
    AUTH_ERROR,
    NETWORK_ERROR,
    INVALID_REPOSITORY
}
