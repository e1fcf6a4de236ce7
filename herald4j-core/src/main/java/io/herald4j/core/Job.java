package io.herald4j.core;

import java.time.Instant;

/**
 * Read model of a publish job. (scheduleId, plannedAt) is globally unique.
 */
public record Job(
        String id,
        String scheduleId,
        Instant plannedAt,

        // content, copied from the schedule at creation
        String templateId,
        String contentId,
        String variantId,
        SelectionPolicy selectionPolicy,
        Long selectionSeed,

        // lifecycle
        JobStatus status,
        int attempt,
        long version,
        Instant createdAt,
        Instant enqueuedAt,
        Instant availableAt,
        Instant startedAt,
        Instant finishedAt,
        Instant nextAttemptAt,
        Instant updatedAt,
        String lastError,
        String externalId,
        String lockedBy
) {

    public boolean isVariantBased() {
        return variantId != null;
    }
}
