package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.domain.model.RefreshKey;
import com.cube.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class RefreshKeyCacheTest {

    private MutableClock clock;
    private RefreshKeyCache cache;
    private final AtomicInteger evaluations = new AtomicInteger();
    private final Function<RefreshKey, String> evaluator = key -> "value-" + evaluations.incrementAndGet();

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        cache = new RefreshKeyCache(Duration.ofSeconds(10), clock);
    }

    @Test
    void testValue_CachedWithinRenewalThreshold() {
        RefreshKey key = RefreshKey.sql("SELECT max(updated_at) FROM orders");

        String first = cache.value(key, evaluator);
        clock.advance(Duration.ofSeconds(9));
        String second = cache.value(key, evaluator);

        assertEquals(first, second);
        assertEquals(1, evaluations.get());
    }

    @Test
    void testValue_ReevaluatedAfterThreshold() {
        RefreshKey key = RefreshKey.sql("SELECT max(updated_at) FROM orders");

        cache.value(key, evaluator);
        clock.advance(Duration.ofSeconds(11));
        String second = cache.value(key, evaluator);

        assertEquals("value-2", second);
    }

    @Test
    void testValue_ParamsAndDataSourceAreSeparateKeys() {
        cache.value(RefreshKey.sql("SELECT max(id) FROM t WHERE tenant = ?", "a"), evaluator);
        cache.value(RefreshKey.sql("SELECT max(id) FROM t WHERE tenant = ?", "b"), evaluator);
        cache.value(RefreshKeyEvaluator.withDefaultDataSource(
                RefreshKey.sql("SELECT max(id) FROM t WHERE tenant = ?", "a"), "replica"), evaluator);

        assertEquals(3, evaluations.get());
    }

    @Test
    void testValue_TimeBasedKeyChangesPerBucket() {
        RefreshKey hourly = RefreshKey.every(Duration.ofHours(1));

        String before = cache.value(hourly, evaluator);
        clock.advance(Duration.ofMinutes(59));
        String sameHour = cache.value(hourly, evaluator);
        clock.advance(Duration.ofMinutes(2));
        String nextHour = cache.value(hourly, evaluator);

        assertEquals(before, sameHour);
        assertNotEquals(before, nextHour);
        assertEquals(0, evaluations.get());
    }

    @Test
    void testFreshnessToken_EmptyWithoutKeys() {
        assertEquals(RefreshKeyCache.NO_REFRESH_KEY, cache.freshnessToken(List.of(), evaluator));
        assertEquals(RefreshKeyCache.NO_REFRESH_KEY, cache.freshnessToken(null, evaluator));
    }

    @Test
    void testFreshnessToken_ChangesWhenAnyKeyChanges() {
        List<RefreshKey> keys = List.of(RefreshKey.sql("SELECT 1"), RefreshKey.every(Duration.ofDays(1)));

        String first = cache.freshnessToken(keys, evaluator);
        cache.invalidateAll();
        String second = cache.freshnessToken(keys, evaluator);

        assertNotEquals(first, second);
    }

    @Test
    void testValue_EvaluatorFailureIsNotCached() {
        RefreshKey key = RefreshKey.sql("SELECT broken");

        assertThrows(IllegalStateException.class, () -> cache.value(key, k -> {
            throw new IllegalStateException("connection refused");
        }));
        assertEquals("value-1", cache.value(key, evaluator));
    }
}
