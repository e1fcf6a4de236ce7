package io.herald4j.core;

import java.time.Instant;

/**
 * Append-only record of a variant chosen for a job. Only read by the no-repeat window.
 */
public record SelectionHistoryEntry(
        String templateId,
        String variantId,
        String scheduleId,
        String jobId,
        Instant plannedAt,
        Instant recordedAt
) {
}
