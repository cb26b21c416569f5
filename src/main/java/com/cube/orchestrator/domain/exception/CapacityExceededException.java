package com.cube.orchestrator.domain.exception;

/**
 * Thrown when a pre-aggregation would need more partitions than {@code maxPartitions} allows.
 */
public class CapacityExceededException extends OrchestratorException {

    private final long requiredPartitions;
    private final int maxPartitions;

    public CapacityExceededException(String preAggregationId, long requiredPartitions, int maxPartitions) {
        super(ErrorKind.CAPACITY_EXCEEDED, String.format(
                "Pre-aggregation '%s' requires more than %d partitions (at least %d); narrow the time range or use a coarser partition granularity",
                preAggregationId, maxPartitions, requiredPartitions));
        this.requiredPartitions = requiredPartitions;
        this.maxPartitions = maxPartitions;
    }

    public long getRequiredPartitions() {
        return requiredPartitions;
    }

    public int getMaxPartitions() {
        return maxPartitions;
    }
}
