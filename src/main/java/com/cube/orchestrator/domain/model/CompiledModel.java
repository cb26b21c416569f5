package com.cube.orchestrator.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Output of the external data-model compiler, as far as the orchestrator cares.
 */
@Value
@Builder
public class CompiledModel {

    String appId;

    String version;

    @Builder.Default
    List<PreAggregationDefinition> preAggregations = List.of();

    Instant compiledAt;

    public Optional<PreAggregationDefinition> findPreAggregation(String id) {
        return preAggregations.stream()
                .filter(definition -> definition.getId().equals(id))
                .findFirst();
    }
}
