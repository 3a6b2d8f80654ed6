package com.geotracking.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geotracking.engine.dto.DeviceSnapshot;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis configuration for the live device state cache.
 *
 * Device snapshots are stored as JSON under {@code device:state:{deviceId}}
 * so other processes (dashboards, the REST read path after a restart) can
 * read the last known state without touching the database.
 */
@Configuration
public class RedisConfig {

    /**
     * Template with String keys and JSON values.
     *
     * Uses Spring Boot's ObjectMapper so {@code Instant} fields are written
     * with the JavaTime module, same as the REST layer.
     */
    @Bean
    public RedisTemplate<String, DeviceSnapshot> deviceStateRedisTemplate(
        RedisConnectionFactory connectionFactory,
        ObjectMapper objectMapper
    ) {
        RedisTemplate<String, DeviceSnapshot> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new Jackson2JsonRedisSerializer<>(objectMapper, DeviceSnapshot.class));

        template.afterPropertiesSet();
        return template;
    }
}
