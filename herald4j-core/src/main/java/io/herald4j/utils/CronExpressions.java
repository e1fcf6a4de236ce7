package io.herald4j.utils;

import io.herald4j.core.ValidationException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.Optional;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cron parsing on top of Quartz {@link CronExpression}.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>5-field unix cron: "0 9 * * 1-5" (seconds are prepended as "0", numeric day-of-week 0-7 is Sunday based)</li>
 *   <li>6-field cron with seconds: "0 0 9 * * MON-FRI" (day-of-week as Quartz reads it)</li>
 *   <li>Native Quartz expressions (7 fields, '?' placeholders) are passed through</li>
 * </ul>
 * <p>
 * Evaluation happens in the schedule zone, so "0 9 * * *" stays at 09:00 local time across DST changes.
 */
public final class CronExpressions {
    private static final Pattern UNIX_DOW_NUMBER = Pattern.compile("(?<![/#\\d])\\d+");

    private CronExpressions() {
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - Accepts 5-field cron by prepending seconds "0" and shifting numeric day-of-week to Quartz numbering.
     * - Accepts 6-field cron.
     * - Puts '?' in whichever of day-of-month/day-of-week is unrestricted.
     */
    public static String normalizeCron(String spec) {
        if (spec == null) {
            throw new ValidationException("cron expression must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new ValidationException("cron expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], unixToQuartzDayOfWeek(parts[4]));
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if ("?".equals(dom) || "?".equals(dow)) {
            return String.join(" ", sec, min, hour, dom, month, dow);
        }
        if ("*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        } else {
            throw new ValidationException(
                    "cron expressions restricting both day-of-month and day-of-week are not supported: "
                            + String.join(" ", sec, min, hour, dayOfMonth, month, dayOfWeek));
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    // unix: 0-7 with 0 and 7 = Sunday; Quartz: 1-7 with 1 = Sunday
    private static String unixToQuartzDayOfWeek(String field) {
        Matcher m = UNIX_DOW_NUMBER.matcher(field);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            int unix = Integer.parseInt(m.group());
            if (unix > 7) {
                throw new ValidationException("day-of-week out of range: " + field);
            }
            m.appendReplacement(sb, Integer.toString((unix % 7) + 1));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Returns true if the string can be parsed as a Quartz {@link CronExpression}.
     */
    public static boolean looksLikeCron(String spec) {
        try {
            return CronExpression.isValidExpression(normalizeCron(spec));
        } catch (Exception ignored) {
            return false;
        }
    }

    /**
     * Compile a (normalized) cron expression bound to a zone.
     *
     * @throws ValidationException if the expression is not valid
     */
    public static CronExpression compile(String spec, ZoneId zone) {
        String cron = normalizeCron(spec);
        if (!CronExpression.isValidExpression(cron)) {
            throw new ValidationException("Invalid cron expression: " + spec);
        }
        try {
            CronExpression exp = new CronExpression(cron);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new ValidationException("Invalid cron expression: " + spec, ex);
        }
    }

    /**
     * Next fire time strictly after {@code after}, or empty when the expression can never fire again
     * (e.g. a year field in the past).
     */
    public static Optional<Instant> nextAfter(String spec, ZoneId zone, Instant after) {
        CronExpression exp = compile(spec, zone);
        Date next = exp.getNextValidTimeAfter(Date.from(after));
        return Optional.ofNullable(next).map(Date::toInstant);
    }
}
