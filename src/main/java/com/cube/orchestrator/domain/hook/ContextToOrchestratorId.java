package com.cube.orchestrator.domain.hook;

import com.cube.orchestrator.domain.model.RequestContext;

import java.util.concurrent.CompletionStage;

/**
 * Derives the key of the isolated orchestrator instance (queues, caches and
 * data-source connections) serving a request.
 */
@FunctionalInterface
public interface ContextToOrchestratorId {

    CompletionStage<String> orchestratorId(RequestContext context);
}
