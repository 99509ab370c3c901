package com.redsched.schedule;

import com.redsched.entry.EntryMeta;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CronScheduleTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:30:00Z");

    @Test
    void remainingUntilNextFireAfterLastRun() {
        CronSchedule hourly = CronSchedule.parse("0 * * * *");
        assertEquals(Duration.ofMinutes(30),
                hourly.remainingEstimate(Instant.parse("2026-03-01T12:00:00Z"), NOW).orElseThrow());
    }

    @Test
    void missedFireIsOverdue() {
        CronSchedule hourly = CronSchedule.parse("0 * * * *");
        assertEquals(Duration.ofMinutes(-30),
                hourly.remainingEstimate(Instant.parse("2026-03-01T11:00:00Z"), NOW).orElseThrow());
    }

    @Test
    void neverRunIsOverdue() {
        CronSchedule daily = new CronSchedule("15", "3", null, null, null);
        assertTrue(daily.remainingEstimate(EntryMeta.MIN_LAST_RUN_AT, NOW).orElseThrow().isNegative());
    }

    @Test
    void dayOfWeekZeroIsSunday() {
        CronSchedule sundayMorning = new CronSchedule("0", "9", "0", "*", "*");
        Instant saturday = Instant.parse("2026-02-28T10:00:00Z");
        assertEquals(Duration.ofHours(23),
                sundayMorning.remainingEstimate(saturday, saturday).orElseThrow());
    }

    @Test
    void parseMapsFieldsInCrontabOrder() {
        CronSchedule schedule = CronSchedule.parse("30 2 15 6 1");
        assertEquals("30", schedule.getMinute());
        assertEquals("2", schedule.getHour());
        assertEquals("15", schedule.getDayOfMonth());
        assertEquals("6", schedule.getMonthOfYear());
        assertEquals("1", schedule.getDayOfWeek());
        assertEquals(new CronSchedule("30", "2", "1", "15", "6"), schedule);
    }

    @Test
    void rejectsMalformedExpression() {
        assertThrows(IllegalArgumentException.class, () -> CronSchedule.parse("* * *"));
        assertThrows(IllegalArgumentException.class, () -> new CronSchedule("61", "*", "*", "*", "*"));
    }
}
