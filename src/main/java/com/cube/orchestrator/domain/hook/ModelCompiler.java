package com.cube.orchestrator.domain.hook;

import com.cube.orchestrator.domain.model.CompiledModel;
import com.cube.orchestrator.domain.model.ModelFile;

import java.util.List;
import java.util.concurrent.CompletionStage;

@FunctionalInterface
public interface ModelCompiler {

    CompletionStage<CompiledModel> compile(String appId, String version, List<ModelFile> files);
}
