package io.herald4j.core;

import java.time.Instant;

/**
 * Optional values written together with a status change. Which of them apply depends on the target status.
 */
public record TransitionFields(
        String error,
        String externalId,
        Instant availableAt,
        Instant nextAttemptAt,
        String workerId
) {

    public static TransitionFields none() {
        return new TransitionFields(null, null, null, null, null);
    }

    public static TransitionFields error(String error) {
        return new TransitionFields(error, null, null, null, null);
    }

    public static TransitionFields retryAt(String error, Instant nextAttemptAt) {
        return new TransitionFields(error, null, null, nextAttemptAt, null);
    }

    public static TransitionFields published(String externalId) {
        return new TransitionFields(null, externalId, null, null, null);
    }

    public static TransitionFields availableAt(Instant availableAt) {
        return new TransitionFields(null, null, availableAt, null, null);
    }

    public static TransitionFields worker(String workerId) {
        return new TransitionFields(null, null, null, null, workerId);
    }
}
