package io.herald4j;

import io.herald4j.core.PermanentPublishException;
import io.herald4j.core.PublishResult;
import io.herald4j.core.TransientPublishException;

import java.util.List;
import java.util.Map;

/**
 * External publishing capability (e.g. a social network client).
 */
public interface Publisher {

    /**
     * Publish text with optional media references.
     *
     * @throws TransientPublishException rate limit, 5xx, timeout: the job is retried
     * @throws PermanentPublishException bad request, auth failure, rejected content: the job is dead-lettered
     */
    PublishResult publish(String text, List<String> mediaRefs)
            throws TransientPublishException, PermanentPublishException;

    /**
     * Engagement metrics for a published item. Consumed downstream of {@link io.herald4j.core.PublishedRecord};
     * the scheduler itself never calls it.
     */
    Map<String, Object> fetchMetrics(String externalId)
            throws TransientPublishException, PermanentPublishException;
}
