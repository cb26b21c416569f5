package com.cube.orchestrator.domain.model;

import lombok.Value;

@Value
public class QueueStats {

    String queueName;
    int pending;
    int running;
    int concurrency;
}
