package com.redsched.entry;

import com.redsched.schedule.Schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One periodic work item: its definition plus its run history.
 *
 * <p>Instances are immutable. {@link #next(Instant, boolean)} returns the successor state
 * and leaves this one untouched; persisting it is the job of {@link ScheduleEntryRepository}.
 */
public final class ScheduleEntry {

    /** Score published for entries whose schedule never fires again. */
    public static final double NEVER_DUE_SCORE = Double.MAX_VALUE;

    private final EntryDefinition definition;
    private final EntryMeta meta;

    public ScheduleEntry(EntryDefinition definition, EntryMeta meta) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.meta = meta != null ? meta : EntryMeta.initial();
    }

    public ScheduleEntry(EntryDefinition definition) {
        this(definition, EntryMeta.initial());
    }

    public EntryDefinition getDefinition() { return definition; }
    public EntryMeta getMeta() { return meta; }

    public String getName() { return definition.name(); }
    public String getTask() { return definition.task(); }
    public Schedule getSchedule() { return definition.schedule(); }
    public List<Object> getArgs() { return definition.args(); }
    public Map<String, Object> getKwargs() { return definition.kwargs(); }
    public Map<String, Object> getOptions() { return definition.options(); }
    public boolean isEnabled() { return definition.enabled(); }
    public Instant getLastRunAt() { return meta.lastRunAt(); }
    public long getTotalRunCount() { return meta.totalRunCount(); }

    /**
     * Successor state after a run at {@code lastRunAt}. The run count is bumped unless
     * {@code onlyUpdateLastRunAt} is set.
     */
    public ScheduleEntry next(Instant lastRunAt, boolean onlyUpdateLastRunAt) {
        Objects.requireNonNull(lastRunAt, "lastRunAt");
        long count = onlyUpdateLastRunAt ? meta.totalRunCount() : meta.totalRunCount() + 1;
        return new ScheduleEntry(definition, new EntryMeta(lastRunAt, count));
    }

    public ScheduleEntry withEnabled(boolean enabled) {
        return new ScheduleEntry(definition.withEnabled(enabled), meta);
    }

    public ScheduleEntry withMeta(EntryMeta meta) {
        return new ScheduleEntry(definition, meta);
    }

    /**
     * When this entry next becomes due, seen from {@code now}. Overdue entries are due
     * at {@code now}; empty if the schedule never fires again.
     */
    public Optional<Instant> dueAt(Instant now) {
        return definition.schedule().remainingEstimate(meta.lastRunAt(), now)
                .map(remaining -> remaining.isNegative() ? now : now.plus(remaining));
    }

    public boolean isDue(Instant now) {
        return dueAt(now).map(due -> !due.isAfter(now)).orElse(false);
    }

    /**
     * Due time as fractional epoch seconds; the value published to the ordered index.
     */
    public double score(Instant now) {
        return dueAt(now).map(ScheduleEntry::toScore).orElse(NEVER_DUE_SCORE);
    }

    public static double toScore(Instant instant) {
        return instant.toEpochMilli() / 1000.0;
    }

    public static Duration untilScore(double score, Instant now) {
        if (score >= NEVER_DUE_SCORE) {
            return Duration.ofSeconds(Long.MAX_VALUE);
        }
        return Duration.ofMillis(Math.round(score * 1000) - now.toEpochMilli());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScheduleEntry other)) return false;
        return definition.equals(other.definition) && meta.equals(other.meta);
    }

    @Override
    public int hashCode() {
        return Objects.hash(definition, meta);
    }

    @Override
    public String toString() {
        return "<Entry: " + definition.name() + " " + definition.task() + " "
                + definition.schedule() + " last_run_at=" + meta.lastRunAt()
                + " total_run_count=" + meta.totalRunCount() + ">";
    }
}
