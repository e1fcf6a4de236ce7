package io.herald4j.core;

/**
 * Malformed schedule definition or content reference: bad recurrence spec, unknown time zone,
 * both or neither content references set.
 */
public class ValidationException extends HeraldException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
