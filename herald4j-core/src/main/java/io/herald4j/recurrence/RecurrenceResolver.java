package io.herald4j.recurrence;

import io.herald4j.core.RecurrenceKind;
import io.herald4j.core.Schedule;
import io.herald4j.core.ValidationException;
import io.herald4j.utils.CronExpressions;
import org.dmfs.rfc5545.recur.InvalidRecurrenceRuleException;
import org.dmfs.rfc5545.recur.RecurrenceRule;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Computes occurrence instants of a schedule.
 *
 * <p>Pure and timezone aware: the same schedule and lower bound always give the same answer. The lower bound is
 * exclusive. An empty result means the schedule is exhausted.
 */
public class RecurrenceResolver {

    /** Hard cap for {@link #occurrences}. */
    public static final int MAX_OCCURRENCES = 300;

    private static final DateTimeFormatter UNTIL_UTC = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'");
    private static final DateTimeFormatter UNTIL_FLOATING = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");
    private static final DateTimeFormatter UNTIL_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final CompiledRuleCache ruleCache;

    public RecurrenceResolver() {
        this(new CompiledRuleCache());
    }

    public RecurrenceResolver(CompiledRuleCache ruleCache) {
        this.ruleCache = Objects.requireNonNull(ruleCache, "ruleCache must not be null");
    }

    /**
     * Next occurrence strictly after {@code after}.
     *
     * @throws ValidationException if the spec or zone is malformed
     */
    public Optional<Instant> resolve(Schedule schedule, Instant after) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(after, "after must not be null");
        if (schedule.kind() == null) {
            throw new ValidationException("Schedule " + schedule.id() + " has no recurrence kind");
        }
        ZoneId zone = schedule.zone();

        return switch (schedule.kind()) {
            case ONE_SHOT -> {
                // the store keeps millisecond precision; a finer instant would look unfired after a round trip
                Instant at = parseOneShot(schedule.spec(), zone).truncatedTo(ChronoUnit.MILLIS);
                yield at.isAfter(after) ? Optional.of(at) : Optional.empty();
            }
            case CRON -> CronExpressions.nextAfter(schedule.spec(), zone, after);
            case RECURRENCE_RULE -> compiledRule(schedule).nextAfter(after);
        };
    }

    /**
     * Occurrences in {@code (from, until]}, at most {@code max} (itself capped at {@link #MAX_OCCURRENCES}).
     */
    public List<Instant> occurrences(Schedule schedule, Instant from, Instant until, int max) {
        Objects.requireNonNull(until, "until must not be null");
        int limit = Math.min(Math.max(max, 0), MAX_OCCURRENCES);
        List<Instant> out = new ArrayList<>();
        Instant cursor = from;
        while (out.size() < limit) {
            Optional<Instant> next = resolve(schedule, cursor);
            if (next.isEmpty() || next.get().isAfter(until)) {
                break;
            }
            out.add(next.get());
            cursor = next.get();
        }
        return out;
    }

    /**
     * Start a recurrence rule is anchored on, in the schedule zone.
     *
     * <p>If the rule pins BYHOUR/BYMINUTE/BYSECOND, the creation wall clock (UTC calendar) is snapped to that
     * time, missing lower fields becoming 0, and moved forward until it is not before the creation instant.
     * Otherwise the creation instant truncated to seconds is used.
     */
    public ZonedDateTime deriveStart(Schedule schedule) {
        if (schedule.kind() != RecurrenceKind.RECURRENCE_RULE) {
            throw new IllegalArgumentException("Only recurrence rules have a derived start: " + schedule.kind());
        }
        ZoneId zone = schedule.zone();
        LocalDateTime start = deriveStart(schedule, parseParts(schedule.spec()), zone);
        return ZonedDateTime.ofLocal(start, zone, null);
    }

    CompiledRule compiledRule(Schedule schedule) {
        ZoneId zone = schedule.zone();
        Map<String, String> parts = parseParts(schedule.spec());
        LocalDateTime start = deriveStart(schedule, parts, zone);
        return ruleCache.get(schedule.id(), schedule.spec(), zone, start, () -> compile(parts, start, zone));
    }

    private static CompiledRule compile(Map<String, String> parts, LocalDateTime start, ZoneId zone) {
        Map<String, String> rewritten = new LinkedHashMap<>(parts);
        String until = rewritten.get("UNTIL");
        if (until != null) {
            rewritten.put("UNTIL", toFloatingUntil(until, zone));
        }
        StringBuilder rule = new StringBuilder();
        rewritten.forEach((k, v) -> {
            if (!rule.isEmpty()) {
                rule.append(';');
            }
            rule.append(k).append('=').append(v);
        });

        try {
            RecurrenceRule parsed = new RecurrenceRule(rule.toString());
            return new CompiledRule(parsed, start, zone, parts.containsKey("COUNT"));
        } catch (InvalidRecurrenceRuleException | IllegalArgumentException e) {
            throw new ValidationException("Invalid recurrence rule: " + rule + " (" + e.getMessage() + ")", e);
        }
    }

    private static LocalDateTime deriveStart(Schedule schedule, Map<String, String> parts, ZoneId zone) {
        Instant created = schedule.createdAt();
        if (created == null) {
            throw new ValidationException("Schedule " + schedule.id() + " has no creation time");
        }
        Integer hour = smallest(parts, "BYHOUR", 23);
        Integer minute = smallest(parts, "BYMINUTE", 59);
        Integer second = smallest(parts, "BYSECOND", 59);

        if (hour == null && minute == null && second == null) {
            return LocalDateTime.ofInstant(created.truncatedTo(ChronoUnit.SECONDS), zone);
        }

        LocalDateTime base = LocalDateTime.ofInstant(created, ZoneOffset.UTC).truncatedTo(ChronoUnit.SECONDS);
        LocalDateTime candidate = base
                .withHour(hour != null ? hour : base.getHour())
                .withMinute(minute != null ? minute : (hour != null ? 0 : base.getMinute()))
                .withSecond(second != null ? second : 0);

        ChronoUnit step = hour != null ? ChronoUnit.DAYS : (minute != null ? ChronoUnit.HOURS : ChronoUnit.MINUTES);
        if (candidate.isBefore(base)) {
            candidate = candidate.plus(1, step);
        }
        while (ZonedDateTime.ofLocal(candidate, zone, null).toInstant().isBefore(created)) {
            candidate = candidate.plus(1, step);
        }
        return candidate;
    }

    private static Integer smallest(Map<String, String> parts, String key, int maxValue) {
        String raw = parts.get(key);
        if (raw == null) {
            return null;
        }
        Integer min = null;
        for (String token : raw.split(",")) {
            int v;
            try {
                v = Integer.parseInt(token.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("Invalid " + key + " value: " + raw, e);
            }
            if (v < 0 || v > maxValue) {
                throw new ValidationException(key + " out of range: " + raw);
            }
            min = min == null ? v : Math.min(min, v);
        }
        return min;
    }

    static Map<String, String> parseParts(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new ValidationException("Recurrence rule must not be empty");
        }
        String rule = spec.trim();
        if (rule.regionMatches(true, 0, "RRULE:", 0, 6)) {
            rule = rule.substring(6);
        }
        Map<String, String> parts = new LinkedHashMap<>();
        for (String part : rule.split(";")) {
            if (part.isBlank()) {
                continue;
            }
            int eq = part.indexOf('=');
            if (eq <= 0 || eq == part.length() - 1) {
                throw new ValidationException("Invalid recurrence rule part '" + part + "' in: " + spec);
            }
            parts.put(part.substring(0, eq).trim().toUpperCase(Locale.ROOT), part.substring(eq + 1).trim());
        }
        if (!parts.containsKey("FREQ")) {
            throw new ValidationException("Recurrence rule has no FREQ: " + spec);
        }
        return parts;
    }

    // the rule is evaluated in floating time, so a UTC bound has to become local wall time
    private static String toFloatingUntil(String until, ZoneId zone) {
        try {
            if (until.endsWith("Z") || until.endsWith("z")) {
                LocalDateTime utc = LocalDateTime.parse(until.toUpperCase(Locale.ROOT), UNTIL_UTC);
                return LocalDateTime.ofInstant(utc.toInstant(ZoneOffset.UTC), zone).format(UNTIL_FLOATING);
            }
            if (until.length() == 8) {
                return LocalDate.parse(until, UNTIL_DATE).atTime(23, 59, 59).format(UNTIL_FLOATING);
            }
            return LocalDateTime.parse(until, UNTIL_FLOATING).format(UNTIL_FLOATING);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid UNTIL value: " + until, e);
        }
    }

    /**
     * One-shot specs: ISO instant ("2024-05-01T09:00:00Z"), offset date-time, or local date-time in the zone.
     */
    static Instant parseOneShot(String spec, ZoneId zone) {
        if (spec == null || spec.isBlank()) {
            throw new ValidationException("One-shot time must not be empty");
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(spec.trim(),
                    ZonedDateTime::from, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            if (parsed instanceof OffsetDateTime offset) {
                return offset.toInstant();
            }
            return ZonedDateTime.ofLocal((LocalDateTime) parsed, zone, null).toInstant();
        } catch (DateTimeException e) {
            throw new ValidationException("Invalid one-shot time: " + spec, e);
        }
    }
}
