package io.herald4j.core;

import java.util.Locale;

/**
 * Which history entries count toward a schedule's no-repeat window.
 */
public enum NoRepeatScope {
    /**
     * Only selections made by the same schedule.
     */
    SCHEDULE,
    /**
     * Selections made by any schedule sharing the template.
     */
    TEMPLATE;

    /**
     * A blank value means {@link #TEMPLATE}.
     */
    public static NoRepeatScope parse(String value) {
        if (value == null || value.isBlank()) {
            return TEMPLATE;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "SCHEDULE", "PER_SCHEDULE" -> SCHEDULE;
            case "TEMPLATE", "PER_TEMPLATE" -> TEMPLATE;
            default -> throw new ValidationException("Unknown no-repeat scope: " + value);
        };
    }
}
