package com.redsched.dispatch;

import com.redsched.entry.EntryDefinition;
import com.redsched.entry.ScheduleEntry;
import com.redsched.schedule.IntervalSchedule;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LoggingTaskDispatcherTest {

    @Test
    void dispatchOnlyLogs() {
        ScheduleEntry entry = new ScheduleEntry(
                new EntryDefinition("report", "tasks.report", IntervalSchedule.ofSeconds(60)));
        assertDoesNotThrow(() -> new LoggingTaskDispatcher().dispatch(entry, Instant.now()));
    }
}
