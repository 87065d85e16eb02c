package com.smartflow.voice.service.cache;

import com.smartflow.voice.config.SmartflowProperties;
import com.smartflow.voice.model.CachedInference;
import com.smartflow.voice.model.dto.CacheStatistics;
import com.smartflow.voice.repository.RedisResponseCacheRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Memoizes inference results.
 *
 * Flow:
 * 1. Local Caffeine-backed TTL cache
 * 2. On local miss, the shared Redis tier when enabled (remaining TTL honoured)
 *
 * Cache failures never fail a request; they degrade to a miss.
 */
@Slf4j
@Service
public class ResponseCache {

    private final SmartflowProperties.CacheConfig config;
    private final Clock clock;
    private final TtlCache<String, CachedInference> local;
    private final Optional<RedisResponseCacheRepository> shared;

    public ResponseCache(SmartflowProperties properties,
                         Clock clock,
                         Optional<RedisResponseCacheRepository> shared) {
        this.config = properties.getCache();
        this.clock = clock;
        this.shared = shared;
        this.local = new TtlCache<>("infer-cache", config.getMaxSize(), config.getTtl(), clock);
        if (shared.isPresent()) {
            log.info("Response cache uses shared Redis tier");
        }
    }

    public Optional<CachedInference> get(String key) {
        if (!config.isEnabled()) {
            return Optional.empty();
        }

        Optional<CachedInference> hit = local.get(key);
        if (hit.isPresent()) {
            log.debug("Response cache HIT (local): {}", key);
            return hit;
        }

        if (shared.isEmpty()) {
            log.debug("Response cache MISS: {}", key);
            return Optional.empty();
        }

        Instant now = clock.instant();
        Optional<CachedInference> remote = shared.get().get(key)
                .filter(entry -> entry.getExpiresAt() != null && entry.getExpiresAt().isAfter(now));
        remote.ifPresent(entry -> {
            local.put(key, entry, Duration.between(now, entry.getExpiresAt()));
            log.debug("Response cache HIT (redis): {}", key);
        });
        return remote;
    }

    public void put(String key, CachedInference value) {
        put(key, value, config.getTtl());
    }

    /**
     * Store a result for {@code ttl}. Stamps creation and expiry instants on the value.
     */
    public void put(String key, CachedInference value, Duration ttl) {
        if (!config.isEnabled()) {
            return;
        }

        Instant now = clock.instant();
        value.setCreatedAt(now);
        value.setExpiresAt(now.plus(ttl));

        local.put(key, value, ttl);
        shared.ifPresent(repository -> repository.put(key, value, ttl));
        log.debug("Stored in response cache: key={}, ttl={}", key, ttl);
    }

    public long purgeExpired() {
        return local.purgeExpired();
    }

    public void clear() {
        local.clear();
        shared.ifPresent(RedisResponseCacheRepository::clear);
        log.info("Cleared response cache");
    }

    public CacheStatistics stats() {
        return local.stats();
    }
}
