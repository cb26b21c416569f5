package com.cube.orchestrator.domain.hook;

import com.cube.orchestrator.domain.model.RequestContext;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Tenants the scheduled refresh worker builds pre-aggregations for.
 */
@FunctionalInterface
public interface ScheduledRefreshContexts {

    CompletionStage<List<RequestContext>> contexts();
}
