package com.redsched.config;

import org.springframework.boot.autoconfigure.data.redis.LettuceClientConfigurationBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Client settings for the schedule store connection. The string template itself comes from
 * Spring Boot's reactive Redis auto-configuration.
 */
@Configuration
public class RedisConfig {

    /**
     * Applies {@code redsched.store-timeout} as the Lettuce command timeout, so a command that
     * never completes is also cancelled on the connection and not only abandoned by the caller.
     */
    @Bean
    public LettuceClientConfigurationBuilderCustomizer storeCommandTimeout(RedschedProperties properties) {
        return builder -> builder.commandTimeout(properties.getStoreTimeout());
    }
}
