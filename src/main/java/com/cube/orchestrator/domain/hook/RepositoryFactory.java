package com.cube.orchestrator.domain.hook;

import com.cube.orchestrator.domain.model.ModelFile;
import com.cube.orchestrator.domain.model.RequestContext;

import java.util.List;
import java.util.concurrent.CompletionStage;

@FunctionalInterface
public interface RepositoryFactory {

    CompletionStage<List<ModelFile>> modelFiles(RequestContext context);
}
