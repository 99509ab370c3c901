package com.redsched.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * A recurrence rule for an entry.
 *
 * <p>Implementations must be immutable and implement {@code equals}; the codec stores them as
 * their {@link #type()} tag plus {@link #arguments()} and rebuilds them through the
 * {@link ScheduleFactory} registered for that tag.
 */
public interface Schedule {

    /**
     * Time left until the schedule is due, given when it last ran.
     * Negative when overdue; empty when the schedule never fires again.
     */
    Optional<Duration> remainingEstimate(Instant lastRunAt, Instant now);

    String type();

    /**
     * Constructor arguments, limited to values the codec can encode.
     */
    Map<String, Object> arguments();
}
