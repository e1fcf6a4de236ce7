package io.herald4j;

import java.time.Instant;

/**
 * Best-effort mutual exclusion keyed by (schedule, occurrence).
 *
 * <p>Only saves redundant resolve/select work across scheduler instances. The job unique index is what
 * guarantees at-most-once job creation, so a failing or missing guard must never block firing.
 */
public interface DedupeGuard {

    /**
     * @return true if this caller may proceed; false if another instance is already handling the occurrence
     */
    boolean tryAcquire(String scheduleId, Instant plannedAt);

    void release(String scheduleId, Instant plannedAt);
}
