package com.redsched.observability;

import com.redsched.config.RedschedProperties;
import com.redsched.test.InMemoryScheduleStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleStoreHealthIndicatorTest {

    @Test
    void reportsIndexedEntryCount() {
        InMemoryScheduleStore store = new InMemoryScheduleStore();
        RedschedProperties properties = new RedschedProperties();
        store.upsertScore(properties.getScheduleKey(), "a", 1.0);
        store.upsertScore(properties.getScheduleKey(), "b", 2.0);

        Health health = new ScheduleStoreHealthIndicator(store, properties).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(2L, health.getDetails().get("entries"));
        assertEquals(":schedule", health.getDetails().get("scheduleKey"));
    }

    @Test
    void downWhenStoreUnavailable() {
        InMemoryScheduleStore store = new InMemoryScheduleStore();
        store.failWith("connection refused");

        Health health = new ScheduleStoreHealthIndicator(store, new RedschedProperties()).health();

        assertEquals(Status.DOWN, health.getStatus());
    }
}
