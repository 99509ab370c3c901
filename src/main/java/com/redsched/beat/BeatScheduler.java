package com.redsched.beat;

import com.redsched.codec.DecodeException;
import com.redsched.config.RedschedProperties;
import com.redsched.dispatch.TaskDispatcher;
import com.redsched.entry.EntryNotFoundException;
import com.redsched.entry.ScheduleEntry;
import com.redsched.entry.ScheduleEntryRepository;
import com.redsched.observability.SchedulerMetrics;
import com.redsched.store.ScheduleStore;
import com.redsched.store.ScheduleStoreException;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides, on each tick, which entries are due and how long the caller may sleep.
 *
 * <p>The working set is read from the ordered index: every entry scored at or before
 * {@code now + max-interval}. Entries further out are left for a later tick. There is no
 * lock; two processes ticking at the same moment can both dispatch the same entry.
 */
@Component
public class BeatScheduler {

    private static final Logger log = LoggerFactory.getLogger(BeatScheduler.class);

    /** Shortest sleep after running an entry whose schedule still reports it due. */
    static final Duration MIN_RERUN_DELAY = Duration.ofSeconds(1);

    private final ScheduleStore store;
    private final ScheduleEntryRepository entries;
    private final TaskDispatcher dispatcher;
    private final SchedulerMetrics metrics;
    private final Clock clock;
    private final String scheduleKey;
    private final Duration maxInterval;

    public BeatScheduler(ScheduleStore store,
                         ScheduleEntryRepository entries,
                         TaskDispatcher dispatcher,
                         SchedulerMetrics metrics,
                         RedschedProperties properties,
                         Clock clock) {
        this.store = store;
        this.entries = entries;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.clock = clock;
        this.scheduleKey = properties.getScheduleKey();
        this.maxInterval = properties.getMaxInterval();
    }

    public Duration getMaxInterval() {
        return maxInterval;
    }

    /**
     * Entries due now or within the horizon, keyed by name, soonest first.
     *
     * @throws ScheduleStoreException if the store cannot be read
     */
    public Map<String, ScheduleEntry> getSchedule() {
        Map<String, ScheduleEntry> schedule = new LinkedHashMap<>();
        for (IndexedEntry indexed : loadWindow(clock.instant())) {
            schedule.put(indexed.entry().getName(), indexed.entry());
        }
        return schedule;
    }

    /**
     * Dispatches and advances every enabled entry that is due, then returns how long to
     * sleep: the time until the nearest upcoming entry, never more than max-interval.
     * The result is always positive. Store failures end the tick early with max-interval;
     * they are not rethrown.
     */
    public Duration tick() {
        Timer.Sample sample = metrics.startTickTimer();
        try {
            Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
            List<IndexedEntry> window;
            try {
                window = loadWindow(now);
            } catch (ScheduleStoreException e) {
                log.warn("Tick aborted, schedule store unavailable: {}", e.getMessage());
                metrics.recordTickFailure();
                return maxInterval;
            }
            metrics.scheduleSize(window.size());

            Duration sleep = maxInterval;
            for (IndexedEntry indexed : window) {
                Duration remaining = maybeDue(indexed, now);
                if (remaining != null && remaining.compareTo(sleep) < 0) {
                    sleep = remaining;
                }
            }
            return sleep;
        } finally {
            metrics.stopTickTimer(sample);
        }
    }

    /**
     * Dispatches the entry if due. Returns the time until it is next due, or {@code null}
     * when it should not bound the sleep (disabled, failed, never due again).
     */
    private Duration maybeDue(IndexedEntry indexed, Instant now) {
        ScheduleEntry entry = indexed.entry();
        if (!entry.isEnabled()) {
            return null;
        }

        Duration untilDue = ScheduleEntry.untilScore(indexed.score(), now);
        if (untilDue.compareTo(Duration.ZERO) > 0) {
            return untilDue;
        }

        try {
            dispatcher.dispatch(entry, now);
        } catch (RuntimeException e) {
            log.error("Message Error: couldn't apply scheduled task {}: {}", entry.getName(), e.getMessage(), e);
            metrics.recordDispatchFailure(entry.getTask());
            return null;
        }
        metrics.recordDispatched(entry.getTask());

        try {
            ScheduleEntry successor = entries.next(entry, now);
            log.debug("Advanced {} to run #{}", successor.getName(), successor.getTotalRunCount());
            return successor.dueAt(now).map(due -> untilRerun(now, due)).orElse(null);
        } catch (ScheduleStoreException e) {
            // score still points at the past, so the entry is picked up again next tick
            log.warn("Dispatched {} but could not record the run: {}", entry.getName(), e.getMessage());
            return null;
        }
    }

    private Duration untilRerun(Instant now, Instant due) {
        Duration remaining = Duration.between(now, due);
        if (remaining.compareTo(Duration.ZERO) > 0) {
            return remaining;
        }
        return MIN_RERUN_DELAY.compareTo(maxInterval) < 0 ? MIN_RERUN_DELAY : maxInterval;
    }

    private List<IndexedEntry> loadWindow(Instant now) {
        double horizon = ScheduleEntry.toScore(now.plus(maxInterval));
        Map<String, Double> scored = store.rangeByScore(scheduleKey, horizon);

        List<IndexedEntry> window = new ArrayList<>(scored.size());
        for (Map.Entry<String, Double> member : scored.entrySet()) {
            String key = member.getKey();
            try {
                window.add(new IndexedEntry(entries.fromKey(key), member.getValue()));
            } catch (EntryNotFoundException e) {
                log.warn("Removing {} from {}: no record stored", key, scheduleKey);
                store.removeScore(scheduleKey, key);
            } catch (DecodeException e) {
                log.error("Skipping corrupt entry {}: {}", key, e.getMessage());
                metrics.recordCorruptEntry();
            }
        }
        log.debug("Loaded {} of {} indexed entries within horizon", window.size(), scored.size());
        return window;
    }

    private record IndexedEntry(ScheduleEntry entry, double score) {}
}
