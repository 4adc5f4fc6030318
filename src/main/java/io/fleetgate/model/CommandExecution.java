package io.fleetgate.model;

public record CommandExecution(
        String id,
        String targetMinionId,
        String payload,
        CommandState state,
        long timeoutMs,
        long startedAtMs,
        Long acknowledgedAtMs,
        Long finishedAtMs,
        Integer exitCode,
        String output,
        boolean outputTruncated,
        String submissionHandle,
        String error,
        String requestedBy
) {
    public boolean terminal() {
        return state.terminal();
    }
}
