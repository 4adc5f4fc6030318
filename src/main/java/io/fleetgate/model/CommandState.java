package io.fleetgate.model;

import java.util.EnumSet;
import java.util.Set;

public enum CommandState {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    TIMED_OUT;

    private static final Set<CommandState> TERMINAL = EnumSet.of(COMPLETED, FAILED, TIMED_OUT);

    public boolean terminal() {
        return TERMINAL.contains(this);
    }
}
