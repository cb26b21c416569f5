package com.cube.orchestrator.infrastructure.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process cache driver ({@code memory}).
 *
 * Entries expire lazily on read; a periodic sweep drops the ones nobody reads again.
 * Not shared between service instances.
 */
@Slf4j
public class LocalCacheDriver implements CacheDriver {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public LocalCacheDriver(Clock clock) {
        this.clock = clock;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Entry entry = entries.get(key);
        if (entry == null) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            log.debug("Cache entry expired for key: {}", key);
            return Optional.empty();
        }
        if (!type.isInstance(entry.value)) {
            log.warn("Cached value for key {} is {}, expected {}", key,
                    entry.value.getClass().getName(), type.getName());
            return Optional.empty();
        }
        log.debug("Cache hit for key: {}", key);
        return Optional.of(type.cast(entry.value));
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
        log.debug("Cached result for key: {} (TTL: {}s)", key, ttl.toSeconds());
    }

    @Override
    public void invalidate(String key) {
        entries.remove(key);
        log.debug("Invalidated cache for key: {}", key);
    }

    @Scheduled(fixedDelay = 60000)
    public void evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int evicted = before - entries.size();
        if (evicted > 0) {
            log.debug("Evicted {} expired cache entries", evicted);
        }
    }

    public int size() {
        return entries.size();
    }

    private static final class Entry {
        private final Object value;
        private final Instant expiresAt;

        private Entry(Object value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
