package com.cube.orchestrator.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Cache entry of a query result, tagged with the refresh-key value it was computed under.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CachedQueryResult {

    private Object value;

    private String freshnessToken;

    private Instant createdAt;
}
