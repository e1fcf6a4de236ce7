package io.herald4j.core;

import java.time.Instant;

/**
 * A job for the same (scheduleId, plannedAt) already exists. This is the expected outcome when two
 * scheduler instances fire the same occurrence, not an operator-facing error.
 */
public class DuplicateJobException extends HeraldException {

    private final String scheduleId;
    private final Instant plannedAt;

    public DuplicateJobException(String scheduleId, Instant plannedAt, Throwable cause) {
        super("Job already exists for scheduleId=" + scheduleId + " plannedAt=" + plannedAt, cause);
        this.scheduleId = scheduleId;
        this.plannedAt = plannedAt;
    }

    public String scheduleId() {
        return scheduleId;
    }

    public Instant plannedAt() {
        return plannedAt;
    }
}
