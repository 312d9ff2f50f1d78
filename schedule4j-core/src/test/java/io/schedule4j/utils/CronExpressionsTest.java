package io.schedule4j.utils;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronExpressionsTest {

    @Test
    void normalizeShouldPrependSecondsToFiveFieldCron() {
        assertEquals("0 */5 * * * ?", CronExpressions.normalizeCron("*/5 * * * *"));
    }

    @Test
    void normalizeShouldReplaceDayOfMonthWhenDayOfWeekIsRestricted() {
        assertEquals("0 0 9 ? * 2-6", CronExpressions.normalizeCron("0 9 * * 1-5"));
    }

    @Test
    void normalizeShouldKeepSevenFieldQuartzCron() {
        assertEquals("0 0 12 ? * WED 2027", CronExpressions.normalizeCron("0 0 12 ? * WED 2027"));
    }

    @Test
    void translateDayOfWeekShouldMapUnixNumbering() {
        assertEquals("1,1", CronExpressions.translateDayOfWeek("0,7"));
        assertEquals("6#3", CronExpressions.translateDayOfWeek("5#3"));
        assertEquals("2/2", CronExpressions.translateDayOfWeek("1/2"));
        assertEquals("MON-FRI", CronExpressions.translateDayOfWeek("MON-FRI"));
    }

    @Test
    void nextOccurrenceShouldSupportFiveFieldCron() {
        Instant next = CronExpressions.nextOccurrenceAfter("*/5 * * * *", ZoneOffset.UTC, Instant.parse("2026-01-01T00:01:00Z"));
        assertEquals(Instant.parse("2026-01-01T00:05:00Z"), next);
    }

    @Test
    void nextOccurrenceShouldBeStrictlyAfter() {
        Instant next = CronExpressions.nextOccurrenceAfter("*/5 * * * *", ZoneOffset.UTC, Instant.parse("2026-01-01T00:05:00Z"));
        assertEquals(Instant.parse("2026-01-01T00:10:00Z"), next);
    }

    @Test
    void nextOccurrenceShouldUseUnixDayOfWeek() {
        // 2026-01-01 is a Thursday
        Instant next = CronExpressions.nextOccurrenceAfter("0 9 * * 1", ZoneOffset.UTC, Instant.parse("2026-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2026-01-05T09:00:00Z"), next);
    }

    @Test
    void nextOccurrenceShouldHonourZone() {
        Instant next = CronExpressions.nextOccurrenceAfter("0 9 * * *", ZoneId.of("Asia/Shanghai"), Instant.parse("2026-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2026-01-01T01:00:00Z"), next);
    }

    @Test
    void invalidCronShouldBeRejected() {
        assertFalse(CronExpressions.isValid("invalid(("));
        assertFalse(CronExpressions.isValid(null));
        assertTrue(CronExpressions.isValid("0 */10 * * * *"));
        assertThrows(IllegalArgumentException.class,
                () -> CronExpressions.nextOccurrenceAfter("invalid((", ZoneOffset.UTC, Instant.now()));
    }

    @Test
    void cronWithoutFutureOccurrenceShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CronExpressions.nextOccurrenceAfter("0 0 0 1 1 ? 2020", ZoneOffset.UTC, Instant.parse("2026-01-01T00:00:00Z")));
    }

    @Test
    void cronRestrictingBothDayFieldsShouldBeRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> CronExpressions.normalizeCron("0 0 1 * 1"));
        assertTrue(ex.getMessage().contains("day-of-month (1) and day-of-week (1)"), ex.getMessage());
        assertFalse(CronExpressions.isValid("0 0 1 * 1"));
        assertFalse(CronExpressions.isValid("30 0 0 15 * MON"));
    }
}
