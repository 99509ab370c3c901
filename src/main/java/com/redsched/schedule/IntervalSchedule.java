package com.redsched.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Fires every {@code every}, measured from the last run.
 */
public record IntervalSchedule(Duration every) implements Schedule {

    public static final String TYPE = "interval";

    public IntervalSchedule {
        if (every == null || every.isNegative() || every.isZero()) {
            throw new IllegalArgumentException("Interval must be positive: " + every);
        }
    }

    public static IntervalSchedule ofSeconds(long seconds) {
        return new IntervalSchedule(Duration.ofSeconds(seconds));
    }

    @Override
    public Optional<Duration> remainingEstimate(Instant lastRunAt, Instant now) {
        return Optional.of(Duration.between(now, lastRunAt.plus(every)));
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Map<String, Object> arguments() {
        return Map.of("every", every);
    }

    public static class Factory implements ScheduleFactory {

        @Override
        public String type() {
            return TYPE;
        }

        @Override
        public Schedule create(Map<String, Object> arguments) {
            Object every = arguments.get("every");
            if (every instanceof Duration duration) {
                return new IntervalSchedule(duration);
            }
            if (every instanceof Long || every instanceof Integer) {
                return new IntervalSchedule(Duration.ofSeconds(((Number) every).longValue()));
            }
            if (every instanceof Number seconds && Double.isFinite(seconds.doubleValue())) {
                // plain seconds, as written by producers without a timedelta tag
                double value = seconds.doubleValue();
                long whole = (long) Math.floor(value);
                return new IntervalSchedule(Duration.ofSeconds(whole, Math.round((value - whole) * 1_000_000_000L)));
            }
            throw new IllegalArgumentException("interval schedule requires 'every' as a timedelta or seconds");
        }
    }
}
