package io.herald4j;

import io.herald4j.core.NoRepeatScope;
import io.herald4j.core.Schedule;
import io.herald4j.core.SelectionPolicy;

import java.time.Instant;

/**
 * Fluent builder for configuring a schedule before persisting it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory schedule with its first nextRunAt resolved</li>
 *   <li>save(): build() + upsert to the store</li>
 * </ul>
 * Exactly one recurrence ({@link #at}, {@link #cron}, {@link #rrule}, {@link #repeatAt}) and exactly one content
 * reference ({@link #content}, {@link #template}) must be given.
 */
public interface ScheduleBuilder {

    /**
     * IANA time zone id (e.g. "America/Chicago"). Null means UTC.
     */
    ScheduleBuilder timezone(String timezone);

    /**
     * Fire once at the specified absolute time.
     */
    ScheduleBuilder at(Instant time);

    ScheduleBuilder cron(String expression);

    /**
     * RFC 5545 recurrence rule, with or without the "RRULE:" prefix.
     */
    ScheduleBuilder rrule(String rule);

    /**
     * Fire every day at a wall-clock time ("09:00" or "09:00:30") in the schedule zone.
     */
    ScheduleBuilder repeatAt(String timeOfDay);

    /**
     * Publish a fixed content item.
     */
    ScheduleBuilder content(String contentId);

    /**
     * Publish a variant of a template, chosen per occurrence.
     */
    ScheduleBuilder template(String templateId);

    ScheduleBuilder policy(SelectionPolicy policy);

    ScheduleBuilder noRepeat(int window, NoRepeatScope scope);

    /**
     * Creation time recurrence rules are anchored on. Defaults to now.
     */
    ScheduleBuilder createdAt(Instant createdAt);

    ScheduleBuilder enabled(boolean enabled);

    Schedule build();

    Schedule save();
}
