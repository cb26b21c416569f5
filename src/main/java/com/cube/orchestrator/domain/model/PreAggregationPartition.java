package com.cube.orchestrator.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One materialized partition of a pre-aggregation.
 *
 * The physical table is {@code <partitionName>_<versionHash>_<builtAt epoch seconds>}
 * so that a new version can be built next to the old one and swapped in.
 */
@Value
@Builder
public class PreAggregationPartition {

    String preAggregationId;

    String partitionName;

    TimeRange range;

    String bucket;

    String schema;

    String tableName;

    String versionHash;

    Instant builtAt;

    public String getQualifiedTableName() {
        return schema + "." + tableName;
    }
}
