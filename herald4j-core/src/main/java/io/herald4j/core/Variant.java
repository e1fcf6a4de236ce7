package io.herald4j.core;

/**
 * One alternative text of a template.
 */
public record Variant(
        String id,
        String templateId,
        String text,
        double weight,
        boolean active
) {
}
