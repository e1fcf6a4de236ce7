package io.herald4j.internal;

import io.herald4j.ScheduleBuilder;
import io.herald4j.core.ContentRef;
import io.herald4j.core.NoRepeatScope;
import io.herald4j.core.RecurrenceKind;
import io.herald4j.core.Schedule;
import io.herald4j.core.SelectionPolicy;
import io.herald4j.core.ValidationException;
import io.herald4j.recurrence.RecurrenceResolver;
import io.herald4j.utils.CronExpressions;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Default {@link ScheduleBuilder} implementation used by the Mongo-backed scheduler.
 */
public class SimpleScheduleBuilder implements ScheduleBuilder {

    private final String id;
    private final RecurrenceResolver resolver;
    private final Function<Schedule, Schedule> persister;
    private final Clock clock;

    private RecurrenceKind kind;
    private String spec;
    private String timezone;
    private String contentId;
    private String templateId;
    private SelectionPolicy policy = SelectionPolicy.UNIFORM_RANDOM;
    private int noRepeatWindow;
    private NoRepeatScope noRepeatScope = NoRepeatScope.TEMPLATE;
    private Instant createdAt;
    private boolean enabled = true;

    public SimpleScheduleBuilder(String id, RecurrenceResolver resolver, Function<Schedule, Schedule> persister, Clock clock) {
        Objects.requireNonNull(id, "schedule id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("schedule id must not be blank");
        }
        this.id = id;
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public ScheduleBuilder timezone(String timezone) {
        Objects.requireNonNull(timezone, "timezone must not be null");
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new ValidationException("Unknown time zone: " + timezone, e);
        }
        this.timezone = timezone;
        return this;
    }

    @Override
    public ScheduleBuilder at(Instant time) {
        Objects.requireNonNull(time, "time must not be null");
        return recurrence(RecurrenceKind.ONE_SHOT, time.toString());
    }

    @Override
    public ScheduleBuilder cron(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        if (!CronExpressions.looksLikeCron(expression)) {
            throw new ValidationException("Invalid cron expression: " + expression);
        }
        return recurrence(RecurrenceKind.CRON, expression.trim());
    }

    @Override
    public ScheduleBuilder rrule(String rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        return recurrence(RecurrenceKind.RECURRENCE_RULE, rule.trim());
    }

    @Override
    public ScheduleBuilder repeatAt(String timeOfDay) {
        Objects.requireNonNull(timeOfDay, "timeOfDay must not be null");
        LocalTime lt = parseTimeOfDay(timeOfDay);
        return recurrence(RecurrenceKind.RECURRENCE_RULE,
                "FREQ=DAILY;BYHOUR=" + lt.getHour() + ";BYMINUTE=" + lt.getMinute() + ";BYSECOND=" + lt.getSecond());
    }

    @Override
    public ScheduleBuilder content(String contentId) {
        this.contentId = Objects.requireNonNull(contentId, "contentId must not be null");
        return this;
    }

    @Override
    public ScheduleBuilder template(String templateId) {
        this.templateId = Objects.requireNonNull(templateId, "templateId must not be null");
        return this;
    }

    @Override
    public ScheduleBuilder policy(SelectionPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        return this;
    }

    @Override
    public ScheduleBuilder noRepeat(int window, NoRepeatScope scope) {
        if (window < 0) {
            throw new IllegalArgumentException("window must not be negative");
        }
        this.noRepeatWindow = window;
        this.noRepeatScope = Objects.requireNonNull(scope, "scope must not be null");
        return this;
    }

    @Override
    public ScheduleBuilder createdAt(Instant createdAt) {
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        return this;
    }

    @Override
    public ScheduleBuilder enabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    /**
     * Validates the definition and resolves the first run after the creation time. A schedule whose only
     * occurrence is already behind it comes back disabled as exhausted.
     */
    @Override
    public Schedule build() {
        if (kind == null) {
            throw new ValidationException("schedule " + id + " needs a recurrence: at, cron, rrule or repeatAt");
        }
        ContentRef content = new ContentRef(contentId, templateId);
        Instant created = createdAt != null ? createdAt : clock.instant();

        Schedule draft = new Schedule(id, kind, spec, timezone, created, content, policy, noRepeatWindow,
                noRepeatScope, null, null, null, enabled, null);
        Optional<Instant> first = resolver.resolve(draft, created);
        if (first.isEmpty()) {
            return new Schedule(id, kind, spec, timezone, created, content, policy, noRepeatWindow,
                    noRepeatScope, null, null, null, false, "exhausted");
        }
        return new Schedule(id, kind, spec, timezone, created, content, policy, noRepeatWindow,
                noRepeatScope, first.get(), null, null, enabled, null);
    }

    @Override
    public Schedule save() {
        return persister.apply(build());
    }

    private ScheduleBuilder recurrence(RecurrenceKind kind, String spec) {
        if (this.kind != null) {
            throw new IllegalStateException("schedule " + id + " already has a " + this.kind + " recurrence");
        }
        this.kind = kind;
        this.spec = spec;
        return this;
    }

    private LocalTime parseTimeOfDay(String timeOfDay) {
        try {
            return LocalTime.parse(timeOfDay.trim());
        } catch (DateTimeParseException ex) {
            throw new ValidationException("Invalid timeOfDay. Expected HH:mm or HH:mm:ss: " + timeOfDay, ex);
        }
    }
}
