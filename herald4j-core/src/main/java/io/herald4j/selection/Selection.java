package io.herald4j.selection;

import io.herald4j.core.SelectionPolicy;
import io.herald4j.core.Variant;

/**
 * Outcome of one variant draw.
 *
 * @param roundRobinCursor position picked in the id-sorted pool for ROUND_ROBIN, null for every other policy
 */
public record Selection(
        Variant variant,
        long seed,
        SelectionPolicy policy,
        Integer roundRobinCursor
) {
}
