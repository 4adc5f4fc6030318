package io.fleetgate.command;

/**
 * Remote execution capability of the automation backend. {@code submit} returns once the job is
 * handed over; acknowledgement and result arrive later through the callback, possibly on another
 * thread and possibly before {@code submit} returns.
 */
public interface CommandBackend {
    SubmissionHandle submit(String targetMinionId, String payload, long timeoutMs, CommandCallback callback);

    /**
     * Starts following a job submitted earlier, possibly by another process, until
     * {@code deadlineMs}. Repeated calls for a job already followed are ignored.
     */
    default void resume(String targetMinionId, SubmissionHandle handle, long deadlineMs, CommandCallback callback) {
    }
}
