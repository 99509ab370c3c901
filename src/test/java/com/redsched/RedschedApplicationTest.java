package com.redsched;

import com.redsched.beat.BeatScheduler;
import com.redsched.beat.BeatService;
import com.redsched.config.RedschedProperties;
import com.redsched.dispatch.RedisListTaskDispatcher;
import com.redsched.dispatch.TaskDispatcher;
import com.redsched.entry.ScheduleEntryRepository;
import com.redsched.store.RedisScheduleStore;
import com.redsched.store.ScheduleStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class RedschedApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private RedschedProperties properties;
    @Autowired private ScheduleStore store;
    @Autowired private TaskDispatcher dispatcher;
    @Autowired private ScheduleEntryRepository entries;
    @Autowired private BeatScheduler scheduler;

    @Test
    void wiresRedisBackedComponents() {
        assertInstanceOf(RedisScheduleStore.class, store);
        assertInstanceOf(RedisListTaskDispatcher.class, dispatcher);
        assertTrue(context.getBeansOfType(BeatService.class).isEmpty());
        assertEquals(1, context.getBeansOfType(ReactiveStringRedisTemplate.class).size());
    }

    @Test
    void bindsConfiguration() {
        assertEquals("it:", properties.getKeyPrefix());
        assertEquals("it::schedule", properties.getScheduleKey());
        assertEquals("it::statics", properties.getStaticsKey());
        assertEquals(Duration.ofSeconds(30), scheduler.getMaxInterval());
        assertEquals("it:heartbeat", entries.keyFor("heartbeat"));

        List<RedschedProperties.EntryProperties> configured = properties.getEntries();
        assertEquals(2, configured.size());
        assertEquals(Duration.ofSeconds(15), configured.get(0).getEvery());
        assertEquals("3", configured.get(1).getCron().getHour());
        assertEquals("*", configured.get(1).getCron().getDayOfWeek());
        assertEquals("backups", configured.get(1).getOptions().get("queue"));
    }
}
