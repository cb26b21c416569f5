package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.domain.hook.Hooks;
import com.cube.orchestrator.domain.model.RefreshKey;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Caches refresh-key values for the renewal threshold so that freshness checks
 * do not hit the data source on every request.
 *
 * SQL keys are evaluated by the supplied evaluator, at most once at a time per key.
 * Time-based keys ({@code every}) are computed locally and never cached.
 */
@Slf4j
public class RefreshKeyCache {

    static final String NO_REFRESH_KEY = "";

    private final Duration renewalThreshold;
    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<String>> inFlight = new ConcurrentHashMap<>();

    public RefreshKeyCache(Duration renewalThreshold, Clock clock) {
        this.renewalThreshold = renewalThreshold;
        this.clock = clock;
    }

    /**
     * Combined freshness token of all refresh keys; changes when any of them changes.
     */
    public String freshnessToken(List<RefreshKey> refreshKeys, Function<RefreshKey, String> evaluator) {
        if (refreshKeys == null || refreshKeys.isEmpty()) {
            return NO_REFRESH_KEY;
        }
        return refreshKeys.stream()
                .map(key -> value(key, evaluator))
                .collect(Collectors.joining("|"));
    }

    public String value(RefreshKey refreshKey, Function<RefreshKey, String> evaluator) {
        if (refreshKey.isTimeBased()) {
            return timeBucket(refreshKey);
        }
        if (refreshKey.getSql() == null) {
            return NO_REFRESH_KEY;
        }
        String cacheKey = cacheKey(refreshKey);
        Instant now = clock.instant();
        Entry cached = entries.get(cacheKey);
        if (cached != null && cached.evaluatedAt.plus(renewalThreshold).isAfter(now)) {
            return cached.value;
        }

        CompletableFuture<String> evaluation = new CompletableFuture<>();
        CompletableFuture<String> existing = inFlight.putIfAbsent(cacheKey, evaluation);
        if (existing != null) {
            return Hooks.await(existing);
        }
        try {
            String value = evaluator.apply(refreshKey);
            entries.put(cacheKey, new Entry(value, clock.instant()));
            log.debug("Refresh key {} evaluated to {}", cacheKey, value);
            evaluation.complete(value);
            return value;
        } catch (RuntimeException e) {
            evaluation.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(cacheKey, evaluation);
        }
    }

    public void invalidateAll() {
        entries.clear();
    }

    public Duration getRenewalThreshold() {
        return renewalThreshold;
    }

    String timeBucket(RefreshKey refreshKey) {
        long everySeconds = Math.max(1, refreshKey.getEvery().toSeconds());
        ZoneId zone = refreshKey.getTimezone() != null ? ZoneId.of(refreshKey.getTimezone()) : ZoneId.of("UTC");
        Instant now = clock.instant();
        long localSeconds = now.getEpochSecond() + zone.getRules().getOffset(now).getTotalSeconds();
        return "every:" + everySeconds + ":" + Math.floorDiv(localSeconds, everySeconds);
    }

    static String cacheKey(RefreshKey refreshKey) {
        return QueryFingerprint.of(refreshKey.getDataSource(), refreshKey.getSql(), refreshKey.getParams());
    }

    private static final class Entry {
        private final String value;
        private final Instant evaluatedAt;

        private Entry(String value, Instant evaluatedAt) {
            this.value = value;
            this.evaluatedAt = evaluatedAt;
        }
    }
}
