package com.redsched.dispatch;

import com.redsched.entry.ScheduleEntry;

import java.time.Instant;

public interface TaskDispatcher {

    /**
     * Hands a due entry's task to the workers. Called with the entry as it was before
     * being advanced; a thrown exception leaves the entry due for the next tick.
     */
    void dispatch(ScheduleEntry entry, Instant scheduledAt);
}
