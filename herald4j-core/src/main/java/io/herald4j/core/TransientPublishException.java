package io.herald4j.core;

/**
 * Rate limit, 5xx, timeout. The job is retried with backoff.
 */
public class TransientPublishException extends PublishException {

    public TransientPublishException(String message) {
        super(message);
    }

    public TransientPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
