package io.herald4j.core;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Read model of a persisted schedule.
 *
 * <p>{@code nextRunAt}, {@code lastRunAt} and {@code roundRobinCursor} are owned by the scheduler tick;
 * everything else is written by whoever registers the schedule.
 */
public record Schedule(
        String id,

        // recurrence
        RecurrenceKind kind,
        String spec,
        String timezone,
        Instant createdAt,

        // content
        ContentRef content,
        SelectionPolicy selectionPolicy,
        int noRepeatWindow,
        NoRepeatScope noRepeatScope,

        // runtime state
        Instant nextRunAt,
        Instant lastRunAt,
        Integer roundRobinCursor,
        boolean enabled,
        String disabledReason
) {

    /**
     * Schedule zone; a null or blank timezone means UTC.
     *
     * @throws ValidationException if the zone id is unknown
     */
    public ZoneId zone() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new ValidationException("Unknown time zone for schedule " + id + ": " + timezone, e);
        }
    }

    public boolean isTemplateBased() {
        return content != null && content.isTemplateBased();
    }

    public SelectionPolicy policyOrDefault() {
        return selectionPolicy == null ? SelectionPolicy.UNIFORM_RANDOM : selectionPolicy;
    }

    public NoRepeatScope scopeOrDefault() {
        return noRepeatScope == null ? NoRepeatScope.TEMPLATE : noRepeatScope;
    }
}
