package com.cube.orchestrator.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * A materialized rollup declared in the data model.
 *
 * Build SQL parameters, in order: partition start and end (partitioned
 * definitions only), then the dimension bucket value (bucketed definitions only).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreAggregationDefinition {

    private String id;

    @Builder.Default
    private String dataSource = QueryRequest.DEFAULT_DATA_SOURCE;

    private String sql;

    private PartitionGranularity partitionGranularity;

    private List<String> buckets;

    private RefreshKey refreshKey;

    /** How far back from now partitions are kept and built by scheduled refresh. */
    private Duration retention;

    /** Partitions ending before {@code now - updateWindow} are never rebuilt once built. */
    private Duration updateWindow;

    @JsonIgnore
    public boolean isPartitioned() {
        return partitionGranularity != null;
    }

    @JsonIgnore
    public boolean isBucketed() {
        return buckets != null && !buckets.isEmpty();
    }

    @JsonIgnore
    public String getTableBaseName() {
        return sanitize(id);
    }

    public static String sanitize(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
    }
}
