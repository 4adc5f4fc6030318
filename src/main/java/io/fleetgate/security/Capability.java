package io.fleetgate.security;

public enum Capability {
    VIEW_FLEET,
    DECIDE_TRUST,
    DISPATCH_COMMAND,
    MANAGE_BACKUPS
}
