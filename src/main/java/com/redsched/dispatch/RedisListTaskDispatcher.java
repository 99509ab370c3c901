package com.redsched.dispatch;

import com.redsched.codec.EntryCodec;
import com.redsched.config.RedschedProperties;
import com.redsched.entry.ScheduleEntry;
import com.redsched.store.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Pushes each due task as a JSON message onto a Redis list that workers pop from.
 * The list is {@code <queue-prefix><queue>}, where the queue comes from the entry's
 * {@code queue} option or {@code redsched.dispatch.default-queue}.
 */
@Component
@ConditionalOnProperty(name = "redsched.dispatch.mode", havingValue = "redis-list", matchIfMissing = true)
public class RedisListTaskDispatcher implements TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RedisListTaskDispatcher.class);

    private final ScheduleStore store;
    private final EntryCodec codec;
    private final String queuePrefix;
    private final String defaultQueue;

    public RedisListTaskDispatcher(ScheduleStore store, EntryCodec codec, RedschedProperties properties) {
        this.store = store;
        this.codec = codec;
        RedschedProperties.DispatchProperties dispatch = properties.getDispatch();
        this.queuePrefix = dispatch.getQueuePrefix() != null
                ? dispatch.getQueuePrefix() : properties.getKeyPrefix() + "queue:";
        this.defaultQueue = dispatch.getDefaultQueue();
    }

    @Override
    public void dispatch(ScheduleEntry entry, Instant scheduledAt) {
        String id = UUID.randomUUID().toString();
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("id", id);
        message.put("task", entry.getTask());
        message.put("args", entry.getArgs());
        message.put("kwargs", entry.getKwargs());
        message.put("options", entry.getOptions());
        message.put("entry", entry.getName());
        message.put("scheduled_at", scheduledAt);

        String queue = queueKey(entry);
        store.push(queue, codec.encode(message));
        log.info("Scheduler: Sending due task {} ({}) id={} queue={}",
                entry.getName(), entry.getTask(), id, queue);
    }

    String queueKey(ScheduleEntry entry) {
        Object queue = entry.getOptions().get("queue");
        return queuePrefix + (queue != null ? queue.toString() : defaultQueue);
    }
}
