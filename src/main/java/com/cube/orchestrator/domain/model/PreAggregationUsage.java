package com.cube.orchestrator.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A pre-aggregation matched to a query by the data-model compiler.
 *
 * {@code tableNamePlaceholder} appears verbatim in the query SQL and is replaced
 * with the partition table(s) covering {@code range} and {@code buckets}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreAggregationUsage {

    private String preAggregationId;

    private String tableNamePlaceholder;

    private TimeRange range;

    private List<String> buckets;
}
