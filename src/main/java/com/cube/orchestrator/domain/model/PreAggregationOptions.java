package com.cube.orchestrator.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Settings of the pre-aggregation manager of one orchestrator instance.
 */
@Value
@Builder
public class PreAggregationOptions {

    /** Only read partitions built by another process; never build. */
    boolean externalRefresh;

    boolean rollupOnlyMode;

    @Builder.Default
    int maxPartitions = 10000;

    /** How long a table listing of a schema is trusted. */
    @Builder.Default
    Duration tableListingTtl = Duration.ofSeconds(10);

    /**
     * How long a superseded table is kept after its successor was built, so queries
     * rewritten to it before the rebuild can still run.
     */
    @Builder.Default
    Duration supersededTableGracePeriod = Duration.ofMinutes(12);

    /** Poll step while waiting for builds without a deadline. */
    @Builder.Default
    Duration pollInterval = Duration.ofSeconds(5);
}
