package com.cube.orchestrator.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;

/**
 * Half-open time interval [from, to).
 */
@Value
public class TimeRange {

    Instant from;
    Instant to;

    @JsonCreator
    public TimeRange(@JsonProperty("from") Instant from, @JsonProperty("to") Instant to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Time range bounds are required");
        }
        if (!to.isAfter(from)) {
            throw new IllegalArgumentException("Time range end " + to + " must be after start " + from);
        }
        this.from = from;
        this.to = to;
    }

    public boolean endsBefore(Instant instant) {
        return !to.isAfter(instant);
    }
}
