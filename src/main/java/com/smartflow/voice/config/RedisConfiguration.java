package com.smartflow.voice.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis wiring for the shared response-cache tier. Only active when
 * {@code smartflow.cache.redis.enabled=true}; a short command timeout keeps a slow Redis
 * from stalling the request path.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "smartflow.cache.redis", name = "enabled", havingValue = "true")
public class RedisConfiguration {

    @Bean
    public LettuceConnectionFactory redisConnectionFactory(RedisProperties redisProperties) {
        SocketOptions socketOptions = SocketOptions.builder()
                .connectTimeout(Duration.ofSeconds(2))
                .keepAlive(true)
                .build();

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(socketOptions)
                .autoReconnect(true)
                .timeoutOptions(TimeoutOptions.enabled(Duration.ofMillis(500)))
                .build();

        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .clientOptions(clientOptions)
                .commandTimeout(Duration.ofMillis(500))
                .build();

        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(
                redisProperties.getHost(), redisProperties.getPort());

        log.info("Configured Redis response-cache tier at {}:{}", redisProperties.getHost(), redisProperties.getPort());
        return new LettuceConnectionFactory(server, clientConfig);
    }

    @Bean
    public RedisTemplate<String, byte[]> responseCacheRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        // values are gzip-compressed by the repository
        template.setValueSerializer(RedisSerializer.byteArray());
        template.afterPropertiesSet();
        return template;
    }
}
