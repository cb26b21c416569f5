package com.cube.orchestrator.domain.model;

import com.cube.orchestrator.domain.exception.ErrorKind;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot of a queue item returned by polling.
 */
@Value
@Builder
public class QueryStatus {

    String queryKey;

    QueueItemStatus status;

    int priority;

    Object result;

    String error;

    ErrorKind errorKind;

    Instant enqueuedAt;

    Instant startedAt;

    Instant finishedAt;

    int requeueCount;
}
