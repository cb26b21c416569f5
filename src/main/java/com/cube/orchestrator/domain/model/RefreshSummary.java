package com.cube.orchestrator.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one scheduled refresh tick.
 */
@Value
@Builder
public class RefreshSummary {

    boolean skipped;

    int contexts;

    int timezones;

    int partitions;

    int failures;

    public static RefreshSummary skipped() {
        return RefreshSummary.builder().skipped(true).build();
    }
}
