package com.redsched.test;

import com.redsched.schedule.Schedule;
import com.redsched.schedule.ScheduleFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Schedule that always reports the same remaining time, whatever the last run.
 */
public record FixedRemainingSchedule(Duration remaining) implements Schedule {

    public static final String TYPE = "fixed";

    public static FixedRemainingSchedule dueNow() {
        return new FixedRemainingSchedule(Duration.ZERO);
    }

    @Override
    public Optional<Duration> remainingEstimate(Instant lastRunAt, Instant now) {
        return Optional.of(remaining);
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Map<String, Object> arguments() {
        return Map.of("remaining_ms", remaining.toMillis());
    }

    public static class Factory implements ScheduleFactory {

        @Override
        public String type() {
            return TYPE;
        }

        @Override
        public Schedule create(Map<String, Object> arguments) {
            return new FixedRemainingSchedule(
                    Duration.ofMillis(((Number) arguments.get("remaining_ms")).longValue()));
        }
    }
}
