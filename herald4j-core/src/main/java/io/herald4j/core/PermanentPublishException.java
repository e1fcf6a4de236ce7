package io.herald4j.core;

/**
 * Bad request, auth failure, content rejected. The job goes straight to dead letter.
 */
public class PermanentPublishException extends PublishException {

    public PermanentPublishException(String message) {
        super(message);
    }

    public PermanentPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
