package com.redsched.dispatch;

import com.redsched.entry.ScheduleEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Records dispatches without sending anything. Useful for dry runs.
 */
@Component
@ConditionalOnProperty(name = "redsched.dispatch.mode", havingValue = "log")
public class LoggingTaskDispatcher implements TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(LoggingTaskDispatcher.class);

    @Override
    public void dispatch(ScheduleEntry entry, Instant scheduledAt) {
        log.info("Scheduler: Sending due task {} ({}) args={} kwargs={} scheduled_at={}",
                entry.getName(), entry.getTask(), entry.getArgs(), entry.getKwargs(), scheduledAt);
    }
}
