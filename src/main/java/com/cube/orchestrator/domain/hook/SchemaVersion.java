package com.cube.orchestrator.domain.hook;

import com.cube.orchestrator.domain.model.RequestContext;

import java.util.concurrent.CompletionStage;

/**
 * Version token of the data model; a new token for an app id forces recompilation.
 */
@FunctionalInterface
public interface SchemaVersion {

    CompletionStage<String> version(RequestContext context);
}
