package io.herald4j.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Publish job lifecycle.
 *
 * <pre>
 * PLANNED  -> ENQUEUED | CANCELLED
 * ENQUEUED -> RUNNING  | CANCELLED
 * RUNNING  -> SUCCEEDED | FAILED
 * FAILED   -> RUNNING (retry) | DEAD_LETTER
 * </pre>
 * SUCCEEDED, DEAD_LETTER and CANCELLED are terminal.
 */
public enum JobStatus {
    PLANNED,
    ENQUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    DEAD_LETTER,
    CANCELLED;

    public Set<JobStatus> successors() {
        Set<JobStatus> next = switch (this) {
            case PLANNED -> EnumSet.of(ENQUEUED, CANCELLED);
            case ENQUEUED -> EnumSet.of(RUNNING, CANCELLED);
            case RUNNING -> EnumSet.of(SUCCEEDED, FAILED);
            case FAILED -> EnumSet.of(RUNNING, DEAD_LETTER);
            case SUCCEEDED, DEAD_LETTER, CANCELLED -> EnumSet.noneOf(JobStatus.class);
        };
        return Collections.unmodifiableSet(next);
    }

    public boolean canTransitionTo(JobStatus target) {
        return target != null && successors().contains(target);
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == DEAD_LETTER || this == CANCELLED;
    }
}
