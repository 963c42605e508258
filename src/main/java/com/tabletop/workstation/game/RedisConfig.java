package com.tabletop.workstation.game;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

@Configuration
@ConditionalOnProperty(name = "workstation.persistence.store", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    @Bean
    public RedisTemplate<String, StoredSnapshot> snapshotRedisTemplate(RedisConnectionFactory connectionFactory,
                                                                       ObjectMapper objectMapper) {
        RedisTemplate<String, StoredSnapshot> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);

        Jackson2JsonRedisSerializer<StoredSnapshot> valueSerializer =
                new Jackson2JsonRedisSerializer<>(objectMapper, StoredSnapshot.class);

        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(valueSerializer);
        template.setHashKeySerializer(new StringRedisSerializer());
        template.setHashValueSerializer(valueSerializer);
        template.afterPropertiesSet();

        return template;
    }
}
