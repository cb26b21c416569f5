package com.cube.orchestrator.config;

import com.cube.orchestrator.domain.hook.CheckAuth;
import com.cube.orchestrator.domain.hook.ContextToAppId;
import com.cube.orchestrator.domain.hook.ContextToOrchestratorId;
import com.cube.orchestrator.domain.hook.DriverFactory;
import com.cube.orchestrator.domain.hook.ModelCompiler;
import com.cube.orchestrator.domain.hook.PreAggregationsSchema;
import com.cube.orchestrator.domain.hook.QueryRewrite;
import com.cube.orchestrator.domain.hook.RepositoryFactory;
import com.cube.orchestrator.domain.hook.ScheduledRefreshContexts;
import com.cube.orchestrator.domain.hook.SchemaVersion;
import com.cube.orchestrator.domain.model.RequestContext;
import com.cube.orchestrator.domain.service.CompiledModelCache;
import com.cube.orchestrator.infrastructure.cache.CacheDriver;
import com.cube.orchestrator.infrastructure.cache.LocalCacheDriver;
import com.cube.orchestrator.infrastructure.cache.RedisCacheDriver;
import com.cube.orchestrator.infrastructure.driver.JdbcQueryDriverProvider;
import com.cube.orchestrator.infrastructure.driver.QueryDriverProvider;
import com.cube.orchestrator.infrastructure.model.DirectoryModelRepository;
import com.cube.orchestrator.infrastructure.model.JsonModelCompiler;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Infrastructure beans and the default implementations of every hook.
 *
 * A host application replaces any hook by declaring its own bean of the hook type;
 * the defaults run a single-tenant orchestrator ("STANDALONE") over the data sources
 * listed under {@code cube.data-sources}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class OrchestratorConfiguration {

    static final String STANDALONE = "STANDALONE";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs queue liveness checks, heartbeat pumps and the scheduled refresh timer.
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("cube-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /**
     * Follows background refreshes of stale cache entries.
     *
     * - Core 2: steady background renewals
     * - Max 8, queue 100: bursts when many entries go stale at once
     * - AbortPolicy: a rejected follow-up is logged; the refresh itself still runs in the query queue
     */
    @Bean("backgroundRefreshExecutor")
    public Executor backgroundRefreshExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("cube-background-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    @ConditionalOnProperty(name = "cube.cache-and-queue-driver", havingValue = "memory", matchIfMissing = true)
    public CacheDriver localCacheDriver(Clock clock) {
        log.info("Using in-memory cache driver");
        return new LocalCacheDriver(clock);
    }

    @Bean
    @ConditionalOnProperty(name = "cube.cache-and-queue-driver", havingValue = "redis")
    public CacheDriver redisCacheDriver(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        log.info("Using Redis cache driver");
        return new RedisCacheDriver(redisTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryDriverProvider queryDriverProvider(OrchestratorProperties properties) {
        return new JdbcQueryDriverProvider(properties.getOrchestrator().getQueryTimeout());
    }

    @Bean
    public CompiledModelCache compiledModelCache(OrchestratorProperties properties, RepositoryFactory repositoryFactory,
                                                 ModelCompiler modelCompiler, Clock clock) {
        return new CompiledModelCache(properties.getCompilerCacheSize(), properties.getMaxCompilerCacheKeepAlive(),
                properties.isUpdateCompilerCacheKeepAlive(), repositoryFactory, modelCompiler, clock);
    }

    // Default hooks

    @Bean
    @ConditionalOnMissingBean
    public CheckAuth checkAuth() {
        return authorization -> CompletableFuture.completedFuture(Map.of());
    }

    @Bean
    @ConditionalOnMissingBean
    public ContextToAppId contextToAppId() {
        return context -> CompletableFuture.completedFuture(STANDALONE);
    }

    @Bean
    @ConditionalOnMissingBean
    public ContextToOrchestratorId contextToOrchestratorId() {
        return context -> CompletableFuture.completedFuture(STANDALONE);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchemaVersion schemaVersion() {
        return context -> CompletableFuture.completedFuture("1");
    }

    @Bean
    @ConditionalOnMissingBean
    public RepositoryFactory repositoryFactory(OrchestratorProperties properties) {
        return new DirectoryModelRepository(Path.of(properties.getSchemaPath()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ModelCompiler modelCompiler(Clock clock) {
        return new JsonModelCompiler(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public DriverFactory driverFactory(OrchestratorProperties properties) {
        return (context, dataSource) -> CompletableFuture.completedFuture(properties.getDataSources().get(dataSource));
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryRewrite queryRewrite() {
        return QueryRewrite.identity();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduledRefreshContexts scheduledRefreshContexts() {
        return () -> CompletableFuture.completedFuture(List.of(RequestContext.of(Map.of())));
    }

    @Bean
    @ConditionalOnMissingBean
    public PreAggregationsSchema preAggregationsSchema(OrchestratorProperties properties) {
        return context -> CompletableFuture.completedFuture(properties.getPreAggregationsSchema());
    }
}
