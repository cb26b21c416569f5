package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.domain.exception.ContinueWaitException;
import com.cube.orchestrator.domain.exception.QueryCancelledException;
import com.cube.orchestrator.domain.hook.Hooks;
import com.cube.orchestrator.domain.model.CacheOptions;
import com.cube.orchestrator.domain.model.CachedQueryResult;
import com.cube.orchestrator.infrastructure.cache.CacheDriver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Query result cache keyed by query fingerprint.
 *
 * Query Flow:
 * 1. Evaluate the refresh keys (through {@link RefreshKeyCache}) into a freshness token
 * 2. Cached entry with the same token: return it
 * 3. Cached entry with another token and backgroundRenew: return it, recompute asynchronously
 * 4. Otherwise compute through the query queue and block (long-poll) for the result
 *
 * Tradeoff: Freshness vs Availability
 * - With backgroundRenew a slow data source never blocks callers that already have an answer
 * - Stale data keeps being served until a refresh succeeds
 *
 * At most one computation per fingerprint runs at a time; concurrent callers join it.
 */
@Slf4j
public class QueryCache {

    private static final String RESULT_PREFIX = "SQL_QUERY_RESULT";
    private static final String QUEUE_PREFIX = "query";

    private final String orchestratorId;
    private final CacheDriver cacheDriver;
    private final QueryQueue queue;
    private final Executor backgroundExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();

    public QueryCache(String orchestratorId, CacheDriver cacheDriver, QueryQueue queue,
                      Executor backgroundExecutor, MeterRegistry meterRegistry, Clock clock) {
        this.orchestratorId = orchestratorId;
        this.cacheDriver = cacheDriver;
        this.queue = queue;
        this.backgroundExecutor = backgroundExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Cached value of the query, computing it with {@code computeTask} when missing or stale.
     *
     * @throws com.cube.orchestrator.domain.exception.ContinueWaitException if the computation
     *         did not finish within {@code options.continueWait}; it keeps running and later
     *         calls join it
     */
    public Object getOrCompute(String fingerprint, Supplier<String> refreshKeyFn, QueryTask computeTask, CacheOptions options) {
        String freshnessToken = refreshKeyFn.get();
        String cacheKey = resultKey(fingerprint);

        Optional<CachedQueryResult> cached = options.isRenewQuery()
                ? Optional.empty()
                : cacheDriver.get(cacheKey, CachedQueryResult.class);

        if (cached.isPresent()) {
            CachedQueryResult entry = cached.get();
            if (Objects.equals(entry.getFreshnessToken(), freshnessToken)) {
                log.debug("Cache hit for query {}", fingerprint);
                count("hit");
                return entry.getValue();
            }
            if (options.isBackgroundRenew()) {
                log.debug("Serving stale result for query {} while refreshing in background", fingerprint);
                count("stale");
                renewInBackground(fingerprint, freshnessToken, computeTask, options);
                return entry.getValue();
            }
        }

        log.debug("Cache miss for query {}", fingerprint);
        count("miss");
        return await(compute(fingerprint, freshnessToken, computeTask, options), options.getContinueWait());
    }

    public void invalidate(String fingerprint) {
        cacheDriver.invalidate(resultKey(fingerprint));
    }

    public boolean isComputing(String fingerprint) {
        return inFlight.containsKey(fingerprint);
    }

    public static String queueKey(String fingerprint) {
        return QUEUE_PREFIX + ":" + fingerprint;
    }

    String resultKey(String fingerprint) {
        return cacheDriver.cacheKey(RESULT_PREFIX, orchestratorId, fingerprint);
    }

    private InFlight compute(String fingerprint, String freshnessToken, QueryTask computeTask, CacheOptions options) {
        InFlight existing = inFlight.get(fingerprint);
        if (existing != null) {
            log.debug("Joining in-flight computation of query {}", fingerprint);
            return existing;
        }
        InFlight candidate = new InFlight(queueKey(fingerprint));
        existing = inFlight.putIfAbsent(fingerprint, candidate);
        if (existing != null) {
            return existing;
        }
        try {
            String handle = queue.enqueue(candidate.handle, options.getPriority(), computeTask, true);
            queue.resultFuture(handle).whenComplete((value, error) -> {
                // cache first so that callers arriving after removal hit the new entry
                if (error == null) {
                    store(fingerprint, value, freshnessToken, options.getExpireAfter());
                }
                inFlight.remove(fingerprint, candidate);
                if (error == null) {
                    candidate.promise.complete(value);
                } else {
                    candidate.promise.completeExceptionally(Hooks.unwrap(error));
                }
            });
        } catch (RuntimeException e) {
            inFlight.remove(fingerprint, candidate);
            candidate.promise.completeExceptionally(e);
        }
        return candidate;
    }

    private void renewInBackground(String fingerprint, String freshnessToken, QueryTask computeTask, CacheOptions options) {
        if (inFlight.containsKey(fingerprint)) {
            log.debug("Background refresh of query {} already running", fingerprint);
            return;
        }
        InFlight computation = compute(fingerprint, freshnessToken, computeTask, options);
        try {
            backgroundExecutor.execute(() -> followBackgroundRefresh(fingerprint, computation, options.getContinueWait()));
        } catch (RejectedExecutionException e) {
            log.warn("Background refresh executor saturated, query {} keeps its stale result for now", fingerprint);
        }
    }

    private void followBackgroundRefresh(String fingerprint, InFlight computation, Duration pollInterval) {
        while (true) {
            try {
                await(computation, pollInterval);
                log.debug("Background refresh of query {} completed", fingerprint);
                return;
            } catch (ContinueWaitException e) {
                log.trace("Background refresh of query {} still running", fingerprint);
            } catch (RuntimeException e) {
                log.error("Background refresh of query {} failed, stale result is kept", fingerprint, e);
                return;
            }
        }
    }

    private Object await(InFlight computation, Duration continueWait) {
        Duration wait = continueWait.compareTo(QueryQueue.MAX_CONTINUE_WAIT) > 0 ? QueryQueue.MAX_CONTINUE_WAIT : continueWait;
        queue.touch(computation.handle);
        try {
            return computation.promise.get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ContinueWaitException(computation.handle);
        } catch (ExecutionException e) {
            throw Hooks.unwrap(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryCancelledException(computation.handle);
        } finally {
            queue.touch(computation.handle);
        }
    }

    private void store(String fingerprint, Object value, String freshnessToken, Duration expireAfter) {
        try {
            cacheDriver.set(resultKey(fingerprint), new CachedQueryResult(value, freshnessToken, clock.instant()), expireAfter);
        } catch (RuntimeException e) {
            log.error("Failed to cache result of query {}", fingerprint, e);
        }
    }

    private void count(String result) {
        Counter.builder("orchestrator.query.cache")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private static final class InFlight {
        private final String handle;
        private final CompletableFuture<Object> promise = new CompletableFuture<>();

        private InFlight(String handle) {
            this.handle = handle;
        }
    }
}
