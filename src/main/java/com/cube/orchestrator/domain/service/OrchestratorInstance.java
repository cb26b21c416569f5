package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.domain.hook.DriverFactory;
import com.cube.orchestrator.domain.hook.Hooks;
import com.cube.orchestrator.domain.model.CacheOptions;
import com.cube.orchestrator.domain.model.QueryRequest;
import com.cube.orchestrator.domain.model.QueryStatus;
import com.cube.orchestrator.domain.model.RefreshKey;
import com.cube.orchestrator.domain.model.RequestContext;
import com.cube.orchestrator.infrastructure.driver.DriverConfig;
import com.cube.orchestrator.infrastructure.driver.QueryDriver;
import com.cube.orchestrator.infrastructure.driver.QueryDriverProvider;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Isolated orchestration state of one orchestrator key: a query queue, a
 * pre-aggregation build queue, the caches on top of them and the data-source
 * connections they use.
 *
 * Data-source drivers are opened on first use through the driver factory hook,
 * called with the context the instance was created for.
 */
@Slf4j
public class OrchestratorInstance {

    private final String id;
    private final RequestContext context;
    private final QueryQueue queryQueue;
    private final QueryQueue preAggregationQueue;
    private final RefreshKeyCache queryRefreshKeys;
    private final RefreshKeyEvaluator queryRefreshKeyEvaluator;
    private final QueryCache queryCache;
    private final PreAggregationManager preAggregations;
    private final DriverFactory driverFactory;
    private final QueryDriverProvider driverProvider;

    private final Map<String, QueryDriver> drivers = new ConcurrentHashMap<>();
    private final Map<String, Object> driverLocks = new ConcurrentHashMap<>();
    private volatile boolean closed;

    @Builder
    OrchestratorInstance(String id, RequestContext context,
                         QueryQueue queryQueue, QueryQueue preAggregationQueue,
                         RefreshKeyCache queryRefreshKeys, QueryCache queryCache,
                         PreAggregationManagerFactory preAggregations, Duration pollInterval,
                         DriverFactory driverFactory, QueryDriverProvider driverProvider) {
        this.id = id;
        this.context = context;
        this.queryQueue = queryQueue;
        this.preAggregationQueue = preAggregationQueue;
        this.queryRefreshKeys = queryRefreshKeys;
        this.queryCache = queryCache;
        this.driverFactory = driverFactory;
        this.driverProvider = driverProvider;
        this.queryRefreshKeyEvaluator = new RefreshKeyEvaluator(queryQueue, this::driver, pollInterval);
        this.preAggregations = preAggregations.create(this::driver);
    }

    public String getId() {
        return id;
    }

    public QueryQueue getQueryQueue() {
        return queryQueue;
    }

    public QueryQueue getPreAggregationQueue() {
        return preAggregationQueue;
    }

    public QueryCache getQueryCache() {
        return queryCache;
    }

    public PreAggregationManager getPreAggregations() {
        return preAggregations;
    }

    /**
     * Query result through the cache; the handle to poll is {@link #queryKey(QueryRequest)}.
     */
    public Object fetchQuery(QueryRequest query, CacheOptions options) {
        String fingerprint = fingerprint(query);
        String dataSource = query.getDataSource();
        List<RefreshKey> refreshKeys = query.getRefreshKeys() == null ? List.of() : query.getRefreshKeys().stream()
                .map(refreshKey -> RefreshKeyEvaluator.withDefaultDataSource(refreshKey, dataSource))
                .collect(Collectors.toList());

        return queryCache.getOrCompute(fingerprint,
                () -> queryRefreshKeys.freshnessToken(refreshKeys, queryRefreshKeyEvaluator),
                task -> driver(dataSource).query(query.getSql(), query.getParams()),
                options);
    }

    public String queryKey(QueryRequest query) {
        return QueryCache.queueKey(fingerprint(query));
    }

    public Optional<QueryStatus> queryStatus(String handle) {
        return queryQueue.poll(handle);
    }

    public boolean cancel(String handle) {
        return queryQueue.cancel(handle);
    }

    /**
     * Driver of a data source, opened on first use.
     *
     * @throws com.cube.orchestrator.domain.exception.DriverConfigException if the hook output is malformed
     */
    public QueryDriver driver(String dataSource) {
        QueryDriver driver = drivers.get(dataSource);
        if (driver != null) {
            return driver;
        }
        synchronized (driverLocks.computeIfAbsent(dataSource, key -> new Object())) {
            driver = drivers.get(dataSource);
            if (driver != null) {
                return driver;
            }
            if (closed) {
                throw new IllegalStateException("Orchestrator " + id + " is shut down");
            }
            Map<String, Object> raw = Hooks.await(driverFactory.driverConfig(context, dataSource));
            DriverConfig config = DriverConfig.from(dataSource, raw);
            int poolSize = config.poolSize(totalConcurrency());
            log.info("Orchestrator {} opening data source {} ({})", id, dataSource, config);
            driver = driverProvider.open(config, poolSize);
            drivers.put(dataSource, driver);
            return driver;
        }
    }

    public int totalConcurrency() {
        return queryQueue.getOptions().getConcurrency() + preAggregationQueue.getOptions().getConcurrency();
    }

    /**
     * Stops both queues and closes every opened data source.
     */
    public void shutdown() {
        closed = true;
        queryQueue.shutdown();
        preAggregationQueue.shutdown();
        drivers.forEach((dataSource, driver) -> {
            try {
                driver.close();
            } catch (RuntimeException e) {
                log.warn("Orchestrator {} failed to close data source {}", id, dataSource, e);
            }
        });
        drivers.clear();
        log.info("Orchestrator {} shut down", id);
    }

    private static String fingerprint(QueryRequest query) {
        return QueryFingerprint.of(query.getDataSource(), query.getSql(), query.getParams());
    }

    /**
     * Creates the pre-aggregation manager once the instance can hand out drivers.
     */
    @FunctionalInterface
    interface PreAggregationManagerFactory {
        PreAggregationManager create(Function<String, QueryDriver> drivers);
    }
}
