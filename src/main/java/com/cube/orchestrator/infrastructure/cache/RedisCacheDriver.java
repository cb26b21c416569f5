package com.cube.orchestrator.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis cache driver ({@code redis}).
 *
 * Shared across service instances, so a result computed by one replica is
 * served by all of them. Values are stored as JSON.
 *
 * Failure Handling:
 * - Circuit breaker prevents Redis outages from blocking queries
 * - Open circuit degrades to cache misses (queries hit the data source)
 */
@Slf4j
@RequiredArgsConstructor
public class RedisCacheDriver implements CacheDriver {

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "getFallback")
    public <T> Optional<T> get(String key, Class<T> type) {
        String cached = redisTemplate.opsForValue().get(key);
        if (cached == null) {
            log.debug("Cache miss for key: {}", key);
            return Optional.empty();
        }
        try {
            T value = objectMapper.readValue(cached, type);
            log.debug("Cache hit for key: {}", key);
            return Optional.of(value);
        } catch (Exception e) {
            log.error("Error reading cache entry {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "setFallback")
    public void set(String key, Object value, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            // cache write failure must not fail the query
            log.error("Error serializing cache entry {}: {}", key, e.getMessage());
            return;
        }
        if (ttl.isZero() || ttl.isNegative()) {
            log.debug("Not caching {}, it is already expired (TTL: {})", key, ttl);
            return;
        }
        // the Duration overload switches to millisecond precision for sub-second TTLs
        redisTemplate.opsForValue().set(key, json, ttl);
        log.debug("Cached result for key: {} (TTL: {})", key, ttl);
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "invalidateFallback")
    public void invalidate(String key) {
        redisTemplate.delete(key);
        log.debug("Invalidated cache for key: {}", key);
    }

    // Fallback methods (circuit breaker)

    private <T> Optional<T> getFallback(String key, Class<T> type, Throwable e) {
        log.warn("Redis unavailable, treating {} as a cache miss: {}", key, e.getMessage());
        return Optional.empty();
    }

    private void setFallback(String key, Object value, Duration ttl, Throwable e) {
        log.warn("Redis unavailable, skipping cache write for {}: {}", key, e.getMessage());
    }

    private void invalidateFallback(String key, Throwable e) {
        log.warn("Redis unavailable, skipping cache invalidation for {}: {}", key, e.getMessage());
    }
}
