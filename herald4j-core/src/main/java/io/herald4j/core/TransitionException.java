package io.herald4j.core;

/**
 * A job state transition could not be applied. The job document is left untouched.
 */
public abstract class TransitionException extends HeraldException {

    private final String jobId;

    protected TransitionException(String jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
