package com.redsched.entry;

import java.time.Instant;

/**
 * Run history of an entry, stored under the {@code meta} field.
 */
public record EntryMeta(Instant lastRunAt, long totalRunCount) {

    /** Sentinel for "never run". */
    public static final Instant MIN_LAST_RUN_AT = Instant.parse("0001-01-01T00:00:00Z");

    private static final EntryMeta INITIAL = new EntryMeta(MIN_LAST_RUN_AT, 0);

    public EntryMeta {
        if (lastRunAt == null) lastRunAt = MIN_LAST_RUN_AT;
        if (totalRunCount < 0) {
            throw new IllegalArgumentException("Run count cannot be negative: " + totalRunCount);
        }
    }

    public static EntryMeta initial() {
        return INITIAL;
    }

    public boolean hasRun() {
        return lastRunAt.isAfter(MIN_LAST_RUN_AT);
    }
}
