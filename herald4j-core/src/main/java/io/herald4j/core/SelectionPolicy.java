package io.herald4j.core;

import java.util.Locale;

/**
 * Closed set of variant selection policies. Resolved once when a schedule is read, never re-parsed per call.
 */
public enum SelectionPolicy {
    UNIFORM_RANDOM,
    WEIGHTED_RANDOM,
    ROUND_ROBIN,
    /**
     * Uniform draw over the pool left after the no-repeat window filter.
     */
    NO_REPEAT_WINDOW;

    /**
     * Whether a draw advances state kept on the schedule (the round-robin cursor).
     */
    public boolean isStateful() {
        return this == ROUND_ROBIN;
    }

    /**
     * Accepts enum names in any case plus the legacy aliases "RANDOM_UNIFORM" and "RANDOM_WEIGHTED".
     * A blank value means {@link #UNIFORM_RANDOM}.
     */
    public static SelectionPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return UNIFORM_RANDOM;
        }
        String v = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (v) {
            case "UNIFORM_RANDOM", "RANDOM_UNIFORM", "RANDOM" -> UNIFORM_RANDOM;
            case "WEIGHTED_RANDOM", "RANDOM_WEIGHTED", "WEIGHTED" -> WEIGHTED_RANDOM;
            case "ROUND_ROBIN" -> ROUND_ROBIN;
            case "NO_REPEAT_WINDOW" -> NO_REPEAT_WINDOW;
            default -> throw new ValidationException("Unknown selection policy: " + value);
        };
    }
}
