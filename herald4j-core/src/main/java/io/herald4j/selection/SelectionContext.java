package io.herald4j.selection;

import java.util.List;

/**
 * Schedule state a draw depends on.
 *
 * @param recentVariantIds variant ids of the most recent history entries in the no-repeat scope, newest first,
 *                         already limited to {@code noRepeatWindow}
 */
public record SelectionContext(
        String scheduleId,
        String templateId,
        Integer roundRobinCursor,
        int noRepeatWindow,
        List<String> recentVariantIds
) {

    public SelectionContext {
        recentVariantIds = recentVariantIds == null ? List.of() : List.copyOf(recentVariantIds);
    }

    public static SelectionContext of(String scheduleId, String templateId) {
        return new SelectionContext(scheduleId, templateId, null, 0, List.of());
    }
}
