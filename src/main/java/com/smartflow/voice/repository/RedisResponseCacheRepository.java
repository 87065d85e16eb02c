package com.smartflow.voice.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartflow.voice.config.SmartflowProperties;
import com.smartflow.voice.model.CachedInference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Shared response-cache tier in Redis, GZIP-compressed JSON values.
 * Key pattern: {prefix}voice:{sha256}
 *
 * <p>Every Redis error is logged and treated as a miss or a skipped write.</p>
 */
@Slf4j
@Repository
@ConditionalOnProperty(prefix = "smartflow.cache.redis", name = "enabled", havingValue = "true")
public class RedisResponseCacheRepository {

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisResponseCacheRepository(
            RedisTemplate<String, byte[]> redisTemplate,
            ObjectMapper objectMapper,
            SmartflowProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = properties.getCache().getRedis().getKeyPrefix();
    }

    public Optional<CachedInference> get(String key) {
        String redisKey = keyPrefix + key;
        try {
            byte[] compressed = redisTemplate.opsForValue().get(redisKey);
            if (compressed == null) {
                log.debug("Redis cache miss: {}", redisKey);
                return Optional.empty();
            }
            return Optional.of(decompress(compressed));
        } catch (Exception e) {
            log.error("Error retrieving from Redis cache: key={}", redisKey, e);
            return Optional.empty();
        }
    }

    public void put(String key, CachedInference value, Duration ttl) {
        String redisKey = keyPrefix + key;
        try {
            byte[] compressed = compress(value);
            redisTemplate.opsForValue().set(redisKey, compressed, ttl);
            log.debug("Stored in Redis cache: key={}, ttl={}, size={}B", redisKey, ttl, compressed.length);
        } catch (Exception e) {
            // cache failures must not fail the request
            log.error("Error storing to Redis cache: key={}", redisKey, e);
        }
    }

    public void clear() {
        try {
            var keys = redisTemplate.keys(keyPrefix + "*");
            if (keys != null && !keys.isEmpty()) {
                redisTemplate.delete(keys);
                log.info("Cleared {} entries from Redis cache", keys.size());
            }
        } catch (Exception e) {
            log.error("Error clearing Redis cache", e);
        }
    }

    private byte[] compress(CachedInference value) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
            gzipOut.write(objectMapper.writeValueAsBytes(value));
        }
        return baos.toByteArray();
    }

    private CachedInference decompress(byte[] compressed) throws IOException {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return objectMapper.readValue(gzipIn.readAllBytes(), CachedInference.class);
        }
    }
}
