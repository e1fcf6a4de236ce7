package io.herald4j.core;

import java.util.Locale;

/**
 * How a schedule's {@code spec} string is interpreted.
 */
public enum RecurrenceKind {
    /**
     * A single ISO-8601 instant (or local date-time in the schedule zone).
     */
    ONE_SHOT,
    /**
     * 5-field or 6-field cron expression evaluated in the schedule zone.
     */
    CRON,
    /**
     * RFC 5545 RRULE evaluated against a start derived from the schedule's creation time.
     */
    RECURRENCE_RULE;

    /**
     * Parses persisted/external kind names. Accepts "one_shot", "cron", "rrule" and the enum names.
     */
    public static RecurrenceKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("recurrence kind must not be blank");
        }
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (v) {
            case "one_shot", "oneshot" -> ONE_SHOT;
            case "cron" -> CRON;
            case "rrule", "recurrence_rule" -> RECURRENCE_RULE;
            default -> throw new ValidationException("Unknown recurrence kind: " + value);
        };
    }
}
