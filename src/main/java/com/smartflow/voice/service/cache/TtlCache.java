package com.smartflow.voice.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.smartflow.voice.model.dto.CacheStatistics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Key/value store with a per-entry time-to-live, backed by Caffeine.
 *
 * <p>Expiry is evaluated against the injected {@link Clock} on every read, so an entry
 * whose TTL has elapsed is never returned even if it has not been purged yet. Size-bound
 * eviction and expiry maintenance run on the calling thread.</p>
 *
 * @param <K> key type
 * @param <V> value type
 */
@Slf4j
public class TtlCache<K, V> {

    private final String name;
    private final long maxSize;
    private final Duration defaultTtl;
    private final Cache<K, Entry<V>> cache;

    public TtlCache(String name, long maxSize, Duration defaultTtl, Clock clock) {
        this.name = name;
        this.maxSize = maxSize;
        this.defaultTtl = defaultTtl;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfter(new PerEntryExpiry<K, V>())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .recordStats()
                .build();
        log.info("Initialized cache [{}] (max size: {}, default TTL: {})", name, maxSize, defaultTtl);
    }

    /**
     * Get a live value. An expired entry is a miss and is dropped as a side effect.
     */
    public Optional<V> get(K key) {
        Entry<V> entry = cache.getIfPresent(key);
        return entry != null ? Optional.of(entry.value) : Optional.empty();
    }

    public void put(K key, V value) {
        put(key, value, defaultTtl);
    }

    /**
     * Store a value that expires {@code ttl} from now, replacing any previous entry.
     * A non-positive TTL removes the key instead.
     */
    public void put(K key, V value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            cache.invalidate(key);
            return;
        }
        cache.put(key, new Entry<>(value, ttl.toNanos()));
    }

    public void invalidate(K key) {
        cache.invalidate(key);
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    /**
     * Remove expired entries now.
     *
     * @return number of entries removed
     */
    public long purgeExpired() {
        long before = cache.estimatedSize();
        cache.cleanUp();
        long purged = Math.max(0, before - cache.estimatedSize());
        if (purged > 0) {
            log.debug("Cache [{}] purged {} expired entries", name, purged);
        }
        return purged;
    }

    public long size() {
        return cache.estimatedSize();
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public CacheStatistics stats() {
        CacheStats stats = cache.stats();
        long total = stats.hitCount() + stats.missCount();
        return CacheStatistics.builder()
                .name(name)
                .size(cache.estimatedSize())
                .maxSize(maxSize)
                .hits(stats.hitCount())
                .misses(stats.missCount())
                .hitRate(total > 0 ? (double) stats.hitCount() / total : 0.0)
                .evictions(stats.evictionCount())
                .build();
    }

    private static final class Entry<V> {
        private final V value;
        private final long ttlNanos;

        private Entry(V value, long ttlNanos) {
            this.value = value;
            this.ttlNanos = ttlNanos;
        }
    }

    private static final class PerEntryExpiry<K, V> implements Expiry<K, Entry<V>> {

        @Override
        public long expireAfterCreate(K key, Entry<V> entry, long currentTime) {
            return entry.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(K key, Entry<V> entry, long currentTime, long currentDuration) {
            return entry.ttlNanos;
        }

        @Override
        public long expireAfterRead(K key, Entry<V> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
