package io.herald4j;

import io.herald4j.core.FixedContent;
import io.herald4j.core.Variant;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to publishable content.
 */
public interface ContentSource {

    /**
     * Active variants of a template in their stored order. Empty when the template is unknown.
     */
    List<Variant> activeVariants(String templateId);

    /**
     * A single variant regardless of its active flag, so a retried job can tell "deactivated" from "gone".
     */
    Optional<Variant> findVariant(String templateId, String variantId);

    Optional<FixedContent> fixedContent(String contentId);
}
