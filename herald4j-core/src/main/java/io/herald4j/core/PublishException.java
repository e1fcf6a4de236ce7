package io.herald4j.core;

/**
 * Failure reported by a {@link io.herald4j.Publisher}. Subtypes decide whether the job is retried.
 */
public abstract class PublishException extends Exception {

    protected PublishException(String message) {
        super(message);
    }

    protected PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
