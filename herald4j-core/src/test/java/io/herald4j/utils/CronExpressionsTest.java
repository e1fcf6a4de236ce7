package io.herald4j.utils;

import io.herald4j.core.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronExpressionsTest {

    private static final ZoneId CHICAGO = ZoneId.of("America/Chicago");

    @Test
    void normalizeShouldPrependSecondsForFiveFieldCron() {
        assertEquals("0 */5 * * * ?", CronExpressions.normalizeCron("*/5 * * * *"));
    }

    @Test
    void normalizeShouldShiftUnixDayOfWeekNumbers() {
        assertEquals("0 0 9 ? * 2-6", CronExpressions.normalizeCron("0 9 * * 1-5"));
        assertEquals("0 0 9 ? * 1", CronExpressions.normalizeCron("0 9 * * 0"));
        assertEquals("0 0 9 ? * 1", CronExpressions.normalizeCron("0 9 * * 7"));
    }

    @Test
    void normalizeShouldKeepSixFieldDayNames() {
        assertEquals("0 0 9 ? * MON-FRI", CronExpressions.normalizeCron("0 0 9 * * MON-FRI"));
    }

    @Test
    void normalizeShouldPlaceQuestionMarkOnDayOfWeekWhenDayOfMonthIsSet() {
        assertEquals("0 0 9 1 * ?", CronExpressions.normalizeCron("0 9 1 * *"));
    }

    @Test
    void normalizeShouldRejectBothDayFieldsRestricted() {
        assertThrows(ValidationException.class, () -> CronExpressions.normalizeCron("0 9 1 * 1"));
    }

    @Test
    void looksLikeCronShouldRecognizeValidSpec() {
        assertTrue(CronExpressions.looksLikeCron("0 */10 * * * *"));
        assertTrue(CronExpressions.looksLikeCron("30 8 * * 1-5"));
        assertFalse(CronExpressions.looksLikeCron("every morning"));
        assertFalse(CronExpressions.looksLikeCron(""));
    }

    @Test
    void nextAfterShouldBeStrictlyAfter() {
        Optional<Instant> next = CronExpressions.nextAfter("*/5 * * * *", ZoneOffset.UTC,
                Instant.parse("2026-01-01T00:05:00Z"));
        assertEquals(Optional.of(Instant.parse("2026-01-01T00:10:00Z")), next);
    }

    @Test
    void nextAfterShouldKeepLocalTimeAcrossSpringForward() {
        Optional<Instant> next = CronExpressions.nextAfter("0 9 * * *", CHICAGO,
                Instant.parse("2024-03-09T15:00:00Z"));
        assertEquals(Optional.of(Instant.parse("2024-03-10T14:00:00Z")), next);
    }

    @Test
    void nextAfterShouldHonorSundayAsZero() {
        // 2024-01-07 is a Sunday
        Optional<Instant> next = CronExpressions.nextAfter("0 9 * * 0", ZoneOffset.UTC,
                Instant.parse("2024-01-01T00:00:00Z"));
        assertEquals(Optional.of(Instant.parse("2024-01-07T09:00:00Z")), next);
    }

    @Test
    void compileShouldRejectGarbage() {
        assertThrows(ValidationException.class, () -> CronExpressions.compile("61 * * * *", ZoneOffset.UTC));
    }
}
