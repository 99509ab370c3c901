package com.redsched.observability;

import com.redsched.config.RedschedProperties;
import com.redsched.store.ScheduleStore;
import com.redsched.store.ScheduleStoreException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class ScheduleStoreHealthIndicator implements HealthIndicator {

    private final ScheduleStore store;
    private final String scheduleKey;

    public ScheduleStoreHealthIndicator(ScheduleStore store, RedschedProperties properties) {
        this.store = store;
        this.scheduleKey = properties.getScheduleKey();
    }

    @Override
    public Health health() {
        try {
            long entries = store.count(scheduleKey);
            return Health.up()
                    .withDetail("scheduleKey", scheduleKey)
                    .withDetail("entries", entries)
                    .build();
        } catch (ScheduleStoreException e) {
            return Health.down(e)
                    .withDetail("scheduleKey", scheduleKey)
                    .build();
        }
    }
}
