package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.config.OrchestratorProperties;
import com.cube.orchestrator.domain.exception.AuthDeniedException;
import com.cube.orchestrator.domain.exception.NoMatchingRollupException;
import com.cube.orchestrator.domain.exception.RecompileRequiredException;
import com.cube.orchestrator.domain.hook.CheckAuth;
import com.cube.orchestrator.domain.hook.ContextToAppId;
import com.cube.orchestrator.domain.hook.ContextToOrchestratorId;
import com.cube.orchestrator.domain.hook.Hooks;
import com.cube.orchestrator.domain.hook.PreAggregationsSchema;
import com.cube.orchestrator.domain.hook.QueryRewrite;
import com.cube.orchestrator.domain.hook.SchemaVersion;
import com.cube.orchestrator.domain.model.CacheOptions;
import com.cube.orchestrator.domain.model.CompiledModel;
import com.cube.orchestrator.domain.model.LoadResponse;
import com.cube.orchestrator.domain.model.PreAggregationDefinition;
import com.cube.orchestrator.domain.model.PreAggregationPartition;
import com.cube.orchestrator.domain.model.PreAggregationUsage;
import com.cube.orchestrator.domain.model.QueryRequest;
import com.cube.orchestrator.domain.model.QueryStatus;
import com.cube.orchestrator.domain.model.RequestContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for query loading.
 *
 * Load Flow:
 * 1. Resolve app id and schema version, get the compiled model
 * 2. Apply the query rewrite hook (row-level security and the like)
 * 3. Get the orchestrator instance of the tenant
 * 4. Rollup-only check, then make sure the referenced partitions exist
 * 5. Point the SQL at the partition tables and run it through the query cache
 *
 * A stale compiled model (a pre-aggregation the query references is unknown)
 * evicts the model and retries the request once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrchestratorService {

    private final OrchestratorRegistry registry;
    private final CompiledModelCache compiledModels;
    private final OrchestratorProperties properties;
    private final CheckAuth checkAuth;
    private final ContextToAppId contextToAppId;
    private final ContextToOrchestratorId contextToOrchestratorId;
    private final SchemaVersion schemaVersion;
    private final QueryRewrite queryRewrite;
    private final PreAggregationsSchema preAggregationsSchema;

    /**
     * Security context of an API caller.
     *
     * @throws AuthDeniedException if the auth hook rejects the request
     */
    public RequestContext authenticate(String authorization) {
        Map<String, Object> securityContext = Hooks.await(checkAuth.authenticate(authorization));
        if (securityContext == null) {
            throw new AuthDeniedException("Authorization rejected");
        }
        return RequestContext.of(securityContext);
    }

    /**
     * Loads a query result.
     *
     * @param continueWait how long to block before answering "continue wait"; null uses the configured timeout
     * @throws com.cube.orchestrator.domain.exception.ContinueWaitException if the result is not ready in time
     */
    public LoadResponse load(RequestContext context, QueryRequest query, Duration continueWait) {
        Duration wait = continueWait != null ? continueWait : properties.getOrchestrator().getContinueWaitTimeout();
        String appId = Hooks.await(contextToAppId.appId(context));
        try {
            return loadOnce(appId, context, query, wait);
        } catch (RecompileRequiredException e) {
            log.info("Recompiling data model of app {}: {}", appId, e.getMessage());
            compiledModels.invalidate(appId);
            return loadOnce(appId, context, query, wait);
        }
    }

    public Optional<QueryStatus> queryStatus(RequestContext context, String handle) {
        return instance(context).queryStatus(handle);
    }

    public boolean cancel(RequestContext context, String handle) {
        return instance(context).cancel(handle);
    }

    /**
     * Builds every pre-aggregation of the context's data model for one time zone.
     *
     * @return number of partitions that are now up to date
     */
    public int refreshPreAggregations(RequestContext context, ZoneId zone) {
        String appId = Hooks.await(contextToAppId.appId(context));
        String version = Hooks.await(schemaVersion.version(context));
        CompiledModel model = compiledModels.getOrCompile(appId, version, context);
        if (model.getPreAggregations().isEmpty()) {
            log.debug("App {} has no pre-aggregations to refresh", appId);
            return 0;
        }
        String schema = Hooks.await(preAggregationsSchema.schema(context));
        return instance(context).getPreAggregations().refresh(model.getPreAggregations(), schema, zone);
    }

    private LoadResponse loadOnce(String appId, RequestContext context, QueryRequest query, Duration continueWait) {
        String version = Hooks.await(schemaVersion.version(context));
        CompiledModel model = compiledModels.getOrCompile(appId, version, context);
        QueryRequest rewritten = Hooks.await(queryRewrite.rewrite(query, context));

        String orchestratorId = Hooks.await(contextToOrchestratorId.orchestratorId(context));
        OrchestratorInstance instance = registry.getOrCreate(orchestratorId, context);
        PreAggregationManager preAggregations = instance.getPreAggregations();
        boolean rollupOnly = properties.getOrchestrator().isRollupOnlyMode();

        if (rollupOnly && !preAggregations.rollupOnlyCheck(rewritten, model)) {
            throw new NoMatchingRollupException("No pre-aggregation matches the query and rollup-only mode is enabled");
        }

        String sql = rewritten.getSql();
        List<String> used = new ArrayList<>();
        List<PreAggregationUsage> usages = rewritten.getPreAggregations() != null ? rewritten.getPreAggregations() : List.of();
        if (!usages.isEmpty()) {
            String schema = Hooks.await(preAggregationsSchema.schema(context));
            ZoneId zone = ZoneId.of(rewritten.getTimezone());
            for (PreAggregationUsage usage : usages) {
                PreAggregationDefinition definition = model.findPreAggregation(usage.getPreAggregationId())
                        .orElseThrow(() -> unknownPreAggregation(usage, rollupOnly));
                List<PreAggregationPartition> partitions = preAggregations.ensurePartitions(
                        definition, schema, usage.getRange(), usage.getBuckets(), zone, continueWait);
                sql = preAggregations.rewriteQuery(sql, usage, partitions);
                used.add(definition.getId());
            }
        }

        QueryRequest executable = rewritten.toBuilder().sql(sql).build();
        CacheOptions options = CacheOptions.builder()
                .backgroundRenew(properties.getOrchestrator().getQueryCache().isBackgroundRenew())
                .renewQuery(executable.isRenewQuery())
                .expireAfter(properties.getOrchestrator().getQueryCache().getExpireAfter())
                .priority(executable.getPriority())
                .continueWait(continueWait)
                .build();
        Object data = instance.fetchQuery(executable, options);

        return LoadResponse.builder()
                .queryKey(instance.queryKey(executable))
                .data(data)
                .usedPreAggregations(used)
                .appId(appId)
                .orchestratorId(orchestratorId)
                .build();
    }

    private OrchestratorInstance instance(RequestContext context) {
        String orchestratorId = Hooks.await(contextToOrchestratorId.orchestratorId(context));
        return registry.getOrCreate(orchestratorId, context);
    }

    private static RuntimeException unknownPreAggregation(PreAggregationUsage usage, boolean rollupOnly) {
        String message = "Pre-aggregation '" + usage.getPreAggregationId() + "' is not defined in the compiled data model";
        return rollupOnly ? new NoMatchingRollupException(message) : new RecompileRequiredException(message);
    }
}
