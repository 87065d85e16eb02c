package com.smartflow.voice.service.cache;

import com.smartflow.voice.model.dto.CacheStatistics;
import com.smartflow.voice.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TtlCacheTest {

    private MutableClock clock;
    private TtlCache<String, String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = new TtlCache<>("test", 100, Duration.ofMinutes(5), clock);
    }

    @Test
    void testGetReturnsLiveEntry() {
        cache.put("a", "alpha");

        clock.advance(Duration.ofMinutes(5).minusMillis(1));

        assertEquals(Optional.of("alpha"), cache.get("a"));
    }

    @Test
    void testExpiredEntryIsNeverReturned() {
        cache.put("a", "alpha");

        clock.advance(Duration.ofMinutes(5).plusMillis(1));

        assertTrue(cache.get("a").isEmpty());
    }

    @Test
    void testPerEntryTtl() {
        cache.put("short", "s", Duration.ofSeconds(10));
        cache.put("long", "l", Duration.ofHours(1));

        clock.advance(Duration.ofSeconds(11));

        assertTrue(cache.get("short").isEmpty());
        assertEquals(Optional.of("l"), cache.get("long"));
    }

    @Test
    void testPutReplacesValueAndTtl() {
        cache.put("a", "first", Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(8));

        cache.put("a", "second", Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(8));

        assertEquals(Optional.of("second"), cache.get("a"));
    }

    @Test
    void testNonPositiveTtlRemovesKey() {
        cache.put("a", "alpha");

        cache.put("a", "beta", Duration.ZERO);

        assertTrue(cache.get("a").isEmpty());
    }

    @Test
    void testPurgeExpiredRemovesOnlyExpired() {
        cache.put("a", "alpha", Duration.ofMinutes(1));
        cache.put("b", "beta", Duration.ofMinutes(1));
        cache.put("c", "gamma", Duration.ofDays(30));

        clock.advance(Duration.ofHours(3));

        assertEquals(2, cache.purgeExpired());
        assertEquals(1, cache.size());
        assertEquals(Optional.of("gamma"), cache.get("c"));
    }

    @Test
    void testSizeBound() {
        TtlCache<String, String> small = new TtlCache<>("small", 2, Duration.ofMinutes(5), clock);

        small.put("a", "1");
        small.put("b", "2");
        small.put("c", "3");
        small.purgeExpired();

        assertEquals(2, small.size());
        assertEquals(1, small.stats().getEvictions());
    }

    @Test
    void testStats() {
        cache.put("a", "alpha");
        cache.get("a");
        cache.get("missing");

        CacheStatistics stats = cache.stats();

        assertEquals("test", stats.getName());
        assertEquals(1, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(0.5, stats.getHitRate(), 0.0001);
        assertEquals(100, stats.getMaxSize());
    }

    @Test
    void testHitRateIsZeroWithoutLookups() {
        assertEquals(0.0, cache.stats().getHitRate());
    }

    @Test
    void testClear() {
        cache.put("a", "alpha");
        cache.put("b", "beta");

        cache.clear();

        assertEquals(0, cache.size());
        assertTrue(cache.get("a").isEmpty());
    }
}
