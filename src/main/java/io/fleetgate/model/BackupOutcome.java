package io.fleetgate.model;

public enum BackupOutcome {
    SUCCESS,
    INITIALIZED_AND_SUCCEEDED,
    FAILED
}
