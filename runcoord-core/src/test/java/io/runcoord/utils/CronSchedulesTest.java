package io.runcoord.utils;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CronSchedulesTest {

    @Test
    void nextAfterShouldBeStrictlyAfterTheGivenInstant() {
        // 2025-09-08 is a Monday
        Instant fireTime = Instant.parse("2025-09-08T09:00:00Z");

        assertEquals(fireTime, CronSchedules.nextAfter("0 9 * * 1", "UTC", Instant.parse("2025-09-08T08:59:59Z")));
        assertEquals(Instant.parse("2025-09-15T09:00:00Z"), CronSchedules.nextAfter("0 9 * * 1", "UTC", fireTime));
    }

    @Test
    void nextAfterShouldHonourTheScheduleTimezoneAcrossDaylightSaving() {
        assertEquals(
                Instant.parse("2025-07-01T13:00:00Z"),
                CronSchedules.nextAfter("0 9 * * *", "America/New_York", Instant.parse("2025-07-01T00:00:00Z")));
        assertEquals(
                Instant.parse("2025-12-01T14:00:00Z"),
                CronSchedules.nextAfter("0 9 * * *", "America/New_York", Instant.parse("2025-12-01T00:00:00Z")));
    }

    @Test
    void blankTimezoneShouldMeanUtc() {
        assertEquals(
                Instant.parse("2025-09-08T09:00:00Z"),
                CronSchedules.nextAfter("0 9 * * *", " ", Instant.parse("2025-09-08T00:00:00Z")));
    }

    @Test
    void unixSundayShouldAcceptZeroAndSeven() {
        Instant after = Instant.parse("2025-09-08T10:00:00Z");
        Instant sunday = Instant.parse("2025-09-14T09:00:00Z");

        assertEquals(sunday, CronSchedules.nextAfter("0 9 * * 0", "UTC", after));
        assertEquals(sunday, CronSchedules.nextAfter("0 9 * * 7", "UTC", after));
    }

    @Test
    void unixWeekdayRangeShouldSkipTheWeekend() {
        // Friday after the fire time
        Instant after = Instant.parse("2025-09-12T10:00:00Z");

        assertEquals(Instant.parse("2025-09-15T09:00:00Z"), CronSchedules.nextAfter("0 9 * * 1-5", "UTC", after));
    }

    @Test
    void unixRangeEndingOnSundayShouldIncludeTheWeekend() {
        // Monday; 5-7 is Friday through Sunday
        Instant after = Instant.parse("2025-09-08T10:00:00Z");

        assertEquals(Instant.parse("2025-09-12T09:00:00Z"), CronSchedules.nextAfter("0 9 * * 5-7", "UTC", after));
        assertEquals(Instant.parse("2025-09-14T09:00:00Z"),
                CronSchedules.nextAfter("0 9 * * 5-7", "UTC", Instant.parse("2025-09-13T10:00:00Z")));
    }

    @Test
    void sixFieldCronShouldBeReadSecondsFirst() {
        assertEquals(
                Instant.parse("2025-09-08T09:15:00Z"),
                CronSchedules.nextAfter("0 */15 * * * *", "UTC", Instant.parse("2025-09-08T09:01:00Z")));
    }

    @Test
    void normalizeCronShouldProduceQuartzSyntax() {
        assertEquals("0 0 9 ? * 2", CronSchedules.normalizeCron("0 9 * * 1"));
        assertEquals("0 30 6 1 * ?", CronSchedules.normalizeCron("30 6 1 * *"));
        assertEquals("0 0 9 ? * MON-FRI", CronSchedules.normalizeCron("0 9 * * MON-FRI"));
    }

    @Test
    void restrictingBothDayFieldsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> CronSchedules.normalizeCron("0 9 1 * 1"));
    }

    @Test
    void invalidInputShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CronSchedules.nextAfter("not a cron", "UTC", Instant.parse("2025-09-08T00:00:00Z")));
        assertThrows(IllegalArgumentException.class,
                () -> CronSchedules.nextAfter("0 9 * * *", "Mars/Olympus", Instant.parse("2025-09-08T00:00:00Z")));
        assertThrows(IllegalArgumentException.class, () -> CronSchedules.validate("", "UTC"));
    }

    @Test
    void validateShouldAcceptSupportedFormats() {
        assertDoesNotThrow(() -> CronSchedules.validate("0 9 * * 1", "Europe/Berlin"));
        assertDoesNotThrow(() -> CronSchedules.validate("0 0 9 ? * MON", null));
        assertThrows(IllegalArgumentException.class, () -> CronSchedules.validate("every monday", "UTC"));
        assertThrows(IllegalArgumentException.class, () -> CronSchedules.validate("0 9 * * 1", "Mars/Olympus"));
    }
}
