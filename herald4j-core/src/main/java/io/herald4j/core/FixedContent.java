package io.herald4j.core;

import java.util.List;

/**
 * Content of a fixed-content schedule.
 */
public record FixedContent(String id, String text, List<String> mediaRefs, boolean deleted) {

    public FixedContent {
        mediaRefs = mediaRefs == null ? List.of() : List.copyOf(mediaRefs);
    }
}
