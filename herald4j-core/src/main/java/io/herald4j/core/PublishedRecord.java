package io.herald4j.core;

import java.time.Instant;

/**
 * Proof of a successful publication. One per job.
 */
public record PublishedRecord(
        String jobId,
        String scheduleId,
        String externalId,
        Instant publishedAt,
        String templateId,
        String variantId
) {
}
