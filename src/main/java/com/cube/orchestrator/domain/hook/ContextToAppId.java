package com.cube.orchestrator.domain.hook;

import com.cube.orchestrator.domain.model.RequestContext;

import java.util.concurrent.CompletionStage;

/**
 * Derives the key of the compiled data model used for a request.
 */
@FunctionalInterface
public interface ContextToAppId {

    CompletionStage<String> appId(RequestContext context);
}
