package com.cube.orchestrator.infrastructure.model;

import com.cube.orchestrator.domain.hook.ModelCompiler;
import com.cube.orchestrator.domain.model.CompiledModel;
import com.cube.orchestrator.domain.model.ModelFile;
import com.cube.orchestrator.domain.model.PreAggregationDefinition;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Default model compiler: reads pre-aggregation definitions from JSON model files.
 *
 * Each {@code *.json} file holds {@code {"preAggregations": [ ... ]}}; other files are ignored.
 * Stands in for a real data-model compiler, which a host application plugs in as its own bean.
 */
@Slf4j
public class JsonModelCompiler implements ModelCompiler {

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();
    private final Clock clock;

    public JsonModelCompiler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public CompletionStage<CompiledModel> compile(String appId, String version, List<ModelFile> files) {
        try {
            return CompletableFuture.completedFuture(compileNow(appId, version, files));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompiledModel compileNow(String appId, String version, List<ModelFile> files) {
        List<PreAggregationDefinition> definitions = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (ModelFile file : files) {
            if (!file.getFileName().endsWith(".json")) {
                log.debug("Skipping model file {}", file.getFileName());
                continue;
            }
            ModelDocument document;
            try {
                document = objectMapper.readValue(file.getContent(), ModelDocument.class);
            } catch (IOException e) {
                throw new IllegalArgumentException("Invalid model file " + file.getFileName() + ": " + e.getMessage(), e);
            }
            for (PreAggregationDefinition definition : document.getPreAggregations()) {
                validate(file, definition);
                if (!ids.add(definition.getId())) {
                    throw new IllegalArgumentException("Duplicate pre-aggregation id '" + definition.getId()
                            + "' in " + file.getFileName());
                }
                definitions.add(definition);
            }
        }
        return CompiledModel.builder()
                .appId(appId)
                .version(version)
                .preAggregations(definitions)
                .compiledAt(clock.instant())
                .build();
    }

    private static void validate(ModelFile file, PreAggregationDefinition definition) {
        if (definition.getId() == null || definition.getId().isBlank()) {
            throw new IllegalArgumentException("Pre-aggregation without id in " + file.getFileName());
        }
        if (definition.getSql() == null || definition.getSql().isBlank()) {
            throw new IllegalArgumentException("Pre-aggregation '" + definition.getId() + "' has no sql");
        }
    }

    @Data
    static class ModelDocument {
        private List<PreAggregationDefinition> preAggregations = new ArrayList<>();
    }
}
