package com.cube.orchestrator.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-call options of the query cache.
 */
@Value
@Builder
public class CacheOptions {

    /** Serve a stale cached value immediately and refresh asynchronously. */
    boolean backgroundRenew;

    /** Ignore any cached value and recompute. */
    boolean renewQuery;

    @Builder.Default
    Duration expireAfter = Duration.ofHours(24);

    int priority;

    @Builder.Default
    Duration continueWait = Duration.ofSeconds(5);
}
