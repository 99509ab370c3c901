package com.redsched.config;

import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RedisConfigTest {

    @Test
    void commandTimeoutFollowsStoreTimeout() {
        RedschedProperties properties = new RedschedProperties();
        properties.setStoreTimeout(Duration.ofMillis(750));

        LettuceClientConfiguration.LettuceClientConfigurationBuilder builder = LettuceClientConfiguration.builder();
        new RedisConfig().storeCommandTimeout(properties).customize(builder);

        assertEquals(Duration.ofMillis(750), builder.build().getCommandTimeout());
    }
}
