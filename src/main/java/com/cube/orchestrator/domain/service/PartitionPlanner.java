package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.domain.exception.CapacityExceededException;
import com.cube.orchestrator.domain.model.PartitionGranularity;
import com.cube.orchestrator.domain.model.PreAggregationDefinition;
import com.cube.orchestrator.domain.model.TimeRange;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a requested range into the partitions of a pre-aggregation.
 *
 * Time partitions are aligned to the granularity in the given zone, so the same
 * range planned for two time zones gives two different partition sets.
 * Every time partition is multiplied by the dimension buckets.
 *
 * Partition names: {@code <base>[_<slot start, UTC yyyyMMddHHmm>][_<bucket>_<bucket hash>]}.
 * The slot start is written in UTC so that names stay unique across zones and DST
 * transitions and sort chronologically.
 */
public class PartitionPlanner {

    static final DateTimeFormatter SLOT_START = DateTimeFormatter.ofPattern("yyyyMMddHHmm").withZone(ZoneOffset.UTC);
    static final int SLOT_START_LENGTH = 12;

    private final int maxPartitions;

    public PartitionPlanner(int maxPartitions) {
        if (maxPartitions <= 0) {
            throw new IllegalArgumentException("maxPartitions must be positive, got: " + maxPartitions);
        }
        this.maxPartitions = maxPartitions;
    }

    /**
     * @param range   required for partitioned definitions, ignored otherwise
     * @param buckets requested buckets; all buckets of the definition when empty
     * @throws CapacityExceededException before anything is built when the plan is too large
     */
    public List<PartitionSpec> plan(PreAggregationDefinition definition, TimeRange range, List<String> buckets, ZoneId zone) {
        List<String> bucketValues = bucketValues(definition, buckets);
        List<TimeRange> slots = definition.isPartitioned()
                ? timeSlots(definition, range, zone, bucketValues.size())
                : Collections.singletonList(null);

        long total = (long) slots.size() * bucketValues.size();
        if (total > maxPartitions) {
            throw new CapacityExceededException(definition.getId(), total, maxPartitions);
        }

        List<PartitionSpec> specs = new ArrayList<>((int) total);
        for (TimeRange slot : slots) {
            for (String bucket : bucketValues) {
                specs.add(spec(definition, slot, bucket));
            }
        }
        return specs;
    }

    public int getMaxPartitions() {
        return maxPartitions;
    }

    private List<TimeRange> timeSlots(PreAggregationDefinition definition, TimeRange range, ZoneId zone, int bucketCount) {
        if (range == null) {
            throw new IllegalArgumentException("Pre-aggregation '" + definition.getId() + "' is partitioned and needs a time range");
        }
        PartitionGranularity granularity = definition.getPartitionGranularity();
        // stop counting as soon as the cap is certainly exceeded
        long slotLimit = maxPartitions / bucketCount + 1;

        List<TimeRange> slots = new ArrayList<>();
        ZonedDateTime start = granularity.truncate(range.getFrom().atZone(zone));
        while (start.toInstant().isBefore(range.getTo())) {
            ZonedDateTime end = granularity.next(start);
            slots.add(new TimeRange(start.toInstant(), end.toInstant()));
            if (slots.size() > slotLimit) {
                throw new CapacityExceededException(definition.getId(), (long) slots.size() * bucketCount, maxPartitions);
            }
            start = end;
        }
        return slots;
    }

    private static List<String> bucketValues(PreAggregationDefinition definition, List<String> requested) {
        if (!definition.isBucketed()) {
            return Collections.singletonList(null);
        }
        return requested != null && !requested.isEmpty() ? requested : definition.getBuckets();
    }

    /**
     * Start of the time slot encoded in a partition name of this definition, or null if
     * the name belongs to another definition or carries no time slot.
     */
    static Instant slotStart(PreAggregationDefinition definition, String partitionName) {
        String prefix = definition.getTableBaseName() + "_";
        if (!definition.isPartitioned() || !partitionName.startsWith(prefix)) {
            return null;
        }
        String rest = partitionName.substring(prefix.length());
        if (rest.length() < SLOT_START_LENGTH || (rest.length() > SLOT_START_LENGTH && rest.charAt(SLOT_START_LENGTH) != '_')) {
            return null;
        }
        try {
            return LocalDateTime.parse(rest.substring(0, SLOT_START_LENGTH), SLOT_START).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static PartitionSpec spec(PreAggregationDefinition definition, TimeRange slot, String bucket) {
        StringBuilder name = new StringBuilder(definition.getTableBaseName());
        List<Object> params = new ArrayList<>();
        if (slot != null) {
            name.append('_').append(SLOT_START.format(slot.getFrom()));
            params.add(slot.getFrom());
            params.add(slot.getTo());
        }
        if (bucket != null) {
            // sanitizing folds case and punctuation, the hash keeps distinct values apart
            name.append('_').append(PreAggregationDefinition.sanitize(bucket))
                    .append('_').append(QueryFingerprint.shortHash(bucket));
            params.add(bucket);
        }
        return new PartitionSpec(name.toString(), slot, bucket, params);
    }
}
