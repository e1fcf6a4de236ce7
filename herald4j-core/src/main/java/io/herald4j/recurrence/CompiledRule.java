package io.herald4j.recurrence;

import org.dmfs.rfc5545.DateTime;
import org.dmfs.rfc5545.recur.RecurrenceRule;
import org.dmfs.rfc5545.recur.RecurrenceRuleIterator;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * An RRULE bound to its start (floating wall time) and the zone its instances are mapped into.
 *
 * <p>Instances are produced as local wall times and converted with {@link ZonedDateTime#ofLocal}, so a time
 * in a spring-forward gap moves forward by the gap length and a time in a fall-back overlap takes the earlier
 * offset.
 */
public final class CompiledRule {

    /** Upper bound on instances inspected per lookup, protects against rules like FREQ=SECONDLY over years. */
    static final int MAX_SCAN = 500_000;

    // DST shifts local time by at most a few hours relative to the instant timeline
    private static final Duration FAST_FORWARD_MARGIN = Duration.ofHours(6);

    private final RecurrenceRule rule;
    private final LocalDateTime start;
    private final ZoneId zone;
    private final boolean counted;

    CompiledRule(RecurrenceRule rule, LocalDateTime start, ZoneId zone, boolean counted) {
        this.rule = rule;
        this.start = start;
        this.zone = zone;
        this.counted = counted;
    }

    public LocalDateTime start() {
        return start;
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * First instance strictly after {@code after}, or empty once COUNT/UNTIL is exhausted.
     */
    public Optional<Instant> nextAfter(Instant after) {
        RecurrenceRuleIterator it = rule.iterator(toDateTime(start));

        // COUNT is evaluated over the full sequence; skipping ahead would miscount it
        if (!counted) {
            LocalDateTime floor = LocalDateTime.ofInstant(after, zone).minus(FAST_FORWARD_MARGIN);
            if (floor.isAfter(start)) {
                it.fastForward(toDateTime(floor));
            }
        }

        int scanned = 0;
        while (it.hasNext()) {
            Instant candidate = toInstant(it.nextDateTime());
            if (candidate.isAfter(after)) {
                return Optional.of(candidate);
            }
            if (++scanned >= MAX_SCAN) {
                throw new IllegalStateException("Recurrence rule scanned " + MAX_SCAN
                        + " instances without passing " + after + ": " + rule);
            }
        }
        return Optional.empty();
    }

    Instant toInstant(DateTime dt) {
        LocalDateTime local = LocalDateTime.of(
                dt.getYear(), dt.getMonth() + 1, dt.getDayOfMonth(),
                dt.getHours(), dt.getMinutes(), dt.getSeconds());
        return ZonedDateTime.ofLocal(local, zone, null).toInstant();
    }

    static DateTime toDateTime(LocalDateTime local) {
        // floating: no zone attached, lib-recur months are 0-based
        return new DateTime(local.getYear(), local.getMonthValue() - 1, local.getDayOfMonth(),
                local.getHour(), local.getMinute(), local.getSecond());
    }
}
