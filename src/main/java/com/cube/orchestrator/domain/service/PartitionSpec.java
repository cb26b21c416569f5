package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.domain.model.TimeRange;
import lombok.Value;

import java.util.List;

/**
 * A partition that should exist, before it is matched to a physical table.
 */
@Value
public class PartitionSpec {

    String partitionName;

    /** Null for definitions without time partitioning. */
    TimeRange range;

    /** Null for definitions without dimension buckets. */
    String bucket;

    /** Parameters bound to the definition's build SQL. */
    List<Object> buildParams;
}
