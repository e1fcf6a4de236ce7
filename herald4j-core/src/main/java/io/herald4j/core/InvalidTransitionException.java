package io.herald4j.core;

/**
 * The requested edge is not in the {@link JobStatus} adjacency table.
 */
public class InvalidTransitionException extends TransitionException {

    private final JobStatus from;
    private final JobStatus to;

    public InvalidTransitionException(String jobId, JobStatus from, JobStatus to) {
        super(jobId, "Invalid transition for job " + jobId + ": " + from + " -> " + to
                + ". Valid transitions from " + from + ": " + (from == null ? "[]" : from.successors()));
        this.from = from;
        this.to = to;
    }

    public JobStatus from() {
        return from;
    }

    public JobStatus to() {
        return to;
    }
}
