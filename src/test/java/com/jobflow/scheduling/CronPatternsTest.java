package com.jobflow.scheduling;

import com.jobflow.broker.CronSchedule;
import org.junit.jupiter.api.*;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CronPatternsTest {

    @Test
    public void testPatternForHash() {
        assertEquals("22 22 * * *", CronPatterns.dailyCronForHash(22, 0));
        assertEquals("22 4 * * *", CronPatterns.dailyCronForHash(22, 6));
        assertEquals("59 23 * * *", CronPatterns.dailyCronForHash(-1, 0));
        assertEquals("0 0 * * *", CronPatterns.dailyCronForHash(0, 24));
    }

    @Test
    public void testSameIdSamePattern() {
        String first = CronPatterns.dailyCronFor("acct-42");

        assertEquals(first, CronPatterns.dailyCronFor("acct-42"));
        assertEquals(CronPatterns.dailyCronForHash("acct-42".hashCode(), 0), first);
    }

    @Test
    public void testOffsetKeepsMinute() {
        String base = CronPatterns.dailyCronFor("acct-42");
        String shifted = CronPatterns.dailyCronFor("acct-42", 6);

        assertEquals(base.split(" ")[0], shifted.split(" ")[0]);
        int hour = Integer.parseInt(base.split(" ")[1]);
        assertEquals((hour + 6) % 24, Integer.parseInt(shifted.split(" ")[1]));
    }

    /**
     * Patterns of many accounts are valid daily crons and spread over the day.
     */
    @Test
    public void testPatternsAreValidAndSpread() {
        Set<String> distinct = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            String pattern = CronPatterns.dailyCronFor("account-" + i);
            CronSchedule.parse(pattern, "UTC");
            distinct.add(pattern);
        }
        assertTrue(distinct.size() > 50, "Expected patterns to spread, got " + distinct.size());
    }

    @Test
    public void testNullIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CronPatterns.dailyCronFor(null));
    }
}
