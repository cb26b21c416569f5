package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.config.OrchestratorProperties;
import com.cube.orchestrator.domain.hook.DriverFactory;
import com.cube.orchestrator.domain.model.PreAggregationOptions;
import com.cube.orchestrator.domain.model.QueueOptions;
import com.cube.orchestrator.domain.model.RequestContext;
import com.cube.orchestrator.infrastructure.cache.CacheDriver;
import com.cube.orchestrator.infrastructure.driver.QueryDriverProvider;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires a new {@link OrchestratorInstance} from the configured queue and cache settings.
 */
@Slf4j
@Component
public class OrchestratorInstanceFactory {

    private final OrchestratorProperties properties;
    private final CacheDriver cacheDriver;
    private final TaskScheduler taskScheduler;
    private final Executor backgroundExecutor;
    private final DriverFactory driverFactory;
    private final QueryDriverProvider driverProvider;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public OrchestratorInstanceFactory(OrchestratorProperties properties,
                                       CacheDriver cacheDriver,
                                       TaskScheduler taskScheduler,
                                       @Qualifier("backgroundRefreshExecutor") Executor backgroundExecutor,
                                       DriverFactory driverFactory,
                                       QueryDriverProvider driverProvider,
                                       MeterRegistry meterRegistry,
                                       Clock clock) {
        this.properties = properties;
        this.cacheDriver = cacheDriver;
        this.taskScheduler = taskScheduler;
        this.backgroundExecutor = backgroundExecutor;
        this.driverFactory = driverFactory;
        this.driverProvider = driverProvider;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public OrchestratorInstance create(String orchestratorId, RequestContext context) {
        OrchestratorProperties.Orchestrator settings = properties.getOrchestrator();
        OrchestratorProperties.QueryCache queryCacheSettings = settings.getQueryCache();
        OrchestratorProperties.PreAggregations preAggregationSettings = settings.getPreAggregations();

        QueryQueue queryQueue = queue(orchestratorId, "queries", queryCacheSettings.getQueue());
        QueryQueue preAggregationQueue = queue(orchestratorId, "pre-aggregations", preAggregationSettings.getQueue());

        PreAggregationOptions preAggregationOptions = PreAggregationOptions.builder()
                .externalRefresh(preAggregationSettings.isExternalRefresh())
                .rollupOnlyMode(settings.isRollupOnlyMode())
                .maxPartitions(preAggregationSettings.getMaxPartitions())
                .tableListingTtl(preAggregationSettings.getRefreshKeyRenewalThreshold())
                .supersededTableGracePeriod(queryCacheSettings.getQueue().getOrphanedTimeout()
                        .plus(queryCacheSettings.getQueue().getExecutionTimeout()))
                .pollInterval(settings.getContinueWaitTimeout())
                .build();
        RefreshKeyCache preAggregationRefreshKeys =
                new RefreshKeyCache(preAggregationSettings.getRefreshKeyRenewalThreshold(), clock);

        OrchestratorInstance instance = OrchestratorInstance.builder()
                .id(orchestratorId)
                .context(context)
                .queryQueue(queryQueue)
                .preAggregationQueue(preAggregationQueue)
                .queryRefreshKeys(new RefreshKeyCache(queryCacheSettings.getRefreshKeyRenewalThreshold(), clock))
                .queryCache(new QueryCache(orchestratorId, cacheDriver, queryQueue, backgroundExecutor, meterRegistry, clock))
                .preAggregations(drivers -> new PreAggregationManager(preAggregationQueue, drivers,
                        preAggregationRefreshKeys,
                        new RefreshKeyEvaluator(preAggregationQueue, drivers, settings.getContinueWaitTimeout()),
                        preAggregationOptions, meterRegistry, clock))
                .pollInterval(settings.getContinueWaitTimeout())
                .driverFactory(driverFactory)
                .driverProvider(driverProvider)
                .build();

        queryQueue.start(taskScheduler);
        preAggregationQueue.start(taskScheduler);
        log.info("Created orchestrator {} (query concurrency {}, pre-aggregation concurrency {})",
                orchestratorId, queryCacheSettings.getQueue().getConcurrency(),
                preAggregationSettings.getQueue().getConcurrency());
        return instance;
    }

    private QueryQueue queue(String orchestratorId, String kind, QueueOptions options) {
        String name = orchestratorId + "-" + kind;
        // cached pool: the queue bounds concurrency, abandoned workers must not block new ones
        ExecutorService workers = Executors.newCachedThreadPool(new CustomizableThreadFactory("cube-" + name + "-"));
        return new QueryQueue(name, options, workers, clock, meterRegistry);
    }
}
