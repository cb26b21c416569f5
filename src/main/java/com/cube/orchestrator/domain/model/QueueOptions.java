package com.cube.orchestrator.domain.model;

import lombok.Data;

import java.time.Duration;

/**
 * Tuning of a single query queue.
 */
@Data
public class QueueOptions {

    private int concurrency = 2;

    private Duration executionTimeout = Duration.ofSeconds(600);

    private Duration orphanedTimeout = Duration.ofSeconds(120);

    private Duration heartBeatInterval = Duration.ofSeconds(30);

    /** Times a heartbeat-lost idempotent item is put back in the queue before it is failed. */
    private int maxRequeues = 3;
}
