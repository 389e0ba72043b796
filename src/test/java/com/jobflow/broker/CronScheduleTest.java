package com.jobflow.broker;

import org.junit.jupiter.api.*;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

public class CronScheduleTest {

    private static final Instant NEW_YEAR = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    public void testTranslatesToQuartzSyntax() {
        assertEquals("0 30 2 * * ?", CronSchedule.toQuartz("30 2 * * *"));
        assertEquals("0 0 9 ? * 2,3,4,5,6", CronSchedule.toQuartz("0 9 * * 1-5"));
        assertEquals("0 0 0 1/2 * ?", CronSchedule.toQuartz("0 0 */2 * *"));
        assertEquals("0 0 9 ? * MON", CronSchedule.toQuartz("0 9 * * MON"));
    }

    @Test
    public void testSundayIsZeroAndSeven() {
        assertEquals("0 0 12 ? * 1", CronSchedule.toQuartz("0 12 * * 0"));
        assertEquals("0 0 12 ? * 1", CronSchedule.toQuartz("0 12 * * 7"));

        Instant next = CronSchedule.parse("0 12 * * 0", "UTC").nextAfter(NEW_YEAR);
        assertEquals(Instant.parse("2024-01-07T12:00:00Z"), next);
    }

    @Test
    public void testNextAfterIsStrictlyAfter() {
        CronSchedule daily = CronSchedule.parse("0 3 * * *", "UTC");

        Instant first = daily.nextAfter(NEW_YEAR);
        assertEquals(Instant.parse("2024-01-01T03:00:00Z"), first);
        assertEquals(Instant.parse("2024-01-02T03:00:00Z"), daily.nextAfter(first));
    }

    @Test
    public void testEvaluatesInTimezone() {
        CronSchedule morning = CronSchedule.parse("0 9 * * *", "Europe/Stockholm");

        assertEquals(Instant.parse("2024-01-01T08:00:00Z"), morning.nextAfter(NEW_YEAR));
    }

    @Test
    public void testRejectsInvalidPatterns() {
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("0 9 * *", "UTC"));
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("0 9 1 * 1", "UTC"));
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("0 25 * * *", "UTC"));
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("0 9 * * 8", "UTC"));
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse(null, "UTC"));
    }

    @Test
    public void testRejectsUnknownTimezone() {
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("0 9 * * *", "Mars/Olympus"));
    }
}
