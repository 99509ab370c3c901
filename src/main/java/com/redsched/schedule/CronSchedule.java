package com.redsched.schedule;

import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Five-field crontab schedule evaluated in UTC.
 * Day of week follows cron convention: 0 or 7 is Sunday.
 */
public final class CronSchedule implements Schedule {

    public static final String TYPE = "crontab";

    private final String minute;
    private final String hour;
    private final String dayOfWeek;
    private final String dayOfMonth;
    private final String monthOfYear;
    private final CronExpression expression;

    public CronSchedule(String minute, String hour, String dayOfWeek,
                        String dayOfMonth, String monthOfYear) {
        this.minute = orWildcard(minute);
        this.hour = orWildcard(hour);
        this.dayOfWeek = orWildcard(dayOfWeek);
        this.dayOfMonth = orWildcard(dayOfMonth);
        this.monthOfYear = orWildcard(monthOfYear);
        // Spring expressions carry a leading seconds field
        this.expression = CronExpression.parse(String.join(" ", "0",
                this.minute, this.hour, this.dayOfMonth, this.monthOfYear, this.dayOfWeek));
    }

    /**
     * Parses a standard five-field expression: minute hour day-of-month month day-of-week.
     */
    public static CronSchedule parse(String fiveFieldExpression) {
        String[] fields = fiveFieldExpression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new IllegalArgumentException("Expected 5 cron fields: " + fiveFieldExpression);
        }
        return new CronSchedule(fields[0], fields[1], fields[4], fields[2], fields[3]);
    }

    @Override
    public Optional<Duration> remainingEstimate(Instant lastRunAt, Instant now) {
        ZonedDateTime next = expression.next(lastRunAt.atZone(ZoneOffset.UTC));
        if (next == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(now, next.toInstant()));
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Map<String, Object> arguments() {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("minute", minute);
        args.put("hour", hour);
        args.put("day_of_week", dayOfWeek);
        args.put("day_of_month", dayOfMonth);
        args.put("month_of_year", monthOfYear);
        return args;
    }

    public String getMinute() { return minute; }
    public String getHour() { return hour; }
    public String getDayOfWeek() { return dayOfWeek; }
    public String getDayOfMonth() { return dayOfMonth; }
    public String getMonthOfYear() { return monthOfYear; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronSchedule other)) return false;
        return minute.equals(other.minute) && hour.equals(other.hour)
                && dayOfWeek.equals(other.dayOfWeek) && dayOfMonth.equals(other.dayOfMonth)
                && monthOfYear.equals(other.monthOfYear);
    }

    @Override
    public int hashCode() {
        return Objects.hash(minute, hour, dayOfWeek, dayOfMonth, monthOfYear);
    }

    @Override
    public String toString() {
        return "<crontab: " + minute + " " + hour + " " + dayOfMonth + " " + monthOfYear
                + " " + dayOfWeek + " (m/h/dM/MY/d)>";
    }

    private static String orWildcard(String field) {
        return field == null || field.isBlank() ? "*" : field.trim();
    }

    public static class Factory implements ScheduleFactory {

        @Override
        public String type() {
            return TYPE;
        }

        @Override
        public Schedule create(Map<String, Object> arguments) {
            return new CronSchedule(
                    asString(arguments.get("minute")),
                    asString(arguments.get("hour")),
                    asString(arguments.get("day_of_week")),
                    asString(arguments.get("day_of_month")),
                    asString(arguments.get("month_of_year")));
        }

        private static String asString(Object value) {
            return value != null ? value.toString() : null;
        }
    }
}
