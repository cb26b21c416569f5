package com.cube.orchestrator.domain.hook;

import com.cube.orchestrator.domain.model.RequestContext;

import java.util.concurrent.CompletionStage;

/**
 * Schema of the target data source where pre-aggregation tables are created.
 */
@FunctionalInterface
public interface PreAggregationsSchema {

    CompletionStage<String> schema(RequestContext context);
}
