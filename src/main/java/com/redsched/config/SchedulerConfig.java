package com.redsched.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.redsched.codec.EntryCodec;
import com.redsched.schedule.ScheduleFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

@Configuration
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Built-in interval and crontab schedules are always decodable; any
     * {@link ScheduleFactory} bean adds another type tag.
     */
    @Bean
    public EntryCodec entryCodec(ObjectMapper objectMapper, ObjectProvider<ScheduleFactory> factories) {
        List<ScheduleFactory> additional = factories.orderedStream().toList();
        if (!additional.isEmpty()) {
            log.info("Registering {} additional schedule types", additional.size());
        }
        return new EntryCodec(objectMapper, additional);
    }
}
