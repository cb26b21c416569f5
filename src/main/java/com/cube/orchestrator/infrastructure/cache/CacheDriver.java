package com.cube.orchestrator.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Storage of cached query results, selected by {@code cube.cache-and-queue-driver}.
 *
 * Implementations never fail a query because of a cache problem: read errors
 * are reported as misses and write errors are logged.
 */
public interface CacheDriver {

    <T> Optional<T> get(String key, Class<T> type);

    void set(String key, Object value, Duration ttl);

    void invalidate(String key);

    /**
     * Generate cache key from parts.
     */
    default String cacheKey(String prefix, Object... parts) {
        StringBuilder key = new StringBuilder(prefix);
        for (Object part : parts) {
            key.append(":").append(part != null ? part.toString() : "null");
        }
        return key.toString();
    }
}
