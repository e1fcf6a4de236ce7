package io.herald4j.core;

/**
 * Base type for herald4j domain failures that callers are not expected to recover from locally.
 */
public class HeraldException extends RuntimeException {

    public HeraldException(String message) {
        super(message);
    }

    public HeraldException(String message, Throwable cause) {
        super(message, cause);
    }
}
