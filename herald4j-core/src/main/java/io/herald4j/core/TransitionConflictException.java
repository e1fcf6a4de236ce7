package io.herald4j.core;

/**
 * Concurrent writers kept changing the job between read and write until the retry budget ran out.
 */
public class TransitionConflictException extends TransitionException {

    public TransitionConflictException(String jobId, JobStatus target, int attempts) {
        super(jobId, "Job " + jobId + " changed concurrently " + attempts + " times while moving to " + target);
    }
}
