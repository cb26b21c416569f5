package com.cube.orchestrator.domain.hook;

import com.cube.orchestrator.domain.model.QueryRequest;
import com.cube.orchestrator.domain.model.RequestContext;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

@FunctionalInterface
public interface QueryRewrite {

    CompletionStage<QueryRequest> rewrite(QueryRequest query, RequestContext context);

    static QueryRewrite identity() {
        return (query, context) -> CompletableFuture.completedFuture(query);
    }
}
