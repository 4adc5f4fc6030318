package io.fleetgate.command;

/** Backend reference for a submitted job, e.g. a Salt job id. */
public record SubmissionHandle(String value) {
}
