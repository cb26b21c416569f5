package com.cube.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Cube Query Orchestrator
 *
 * Sits between the API layer of an analytics engine and its data sources.
 *
 * Architecture:
 * - One isolated orchestrator instance per tenant (queues, caches, connections)
 * - Bounded, prioritized query queue with timeouts and heartbeats
 * - Query result cache invalidated by refresh keys
 * - Pre-aggregation tables built per partition in a dedicated queue
 * - Scheduled refresh worker keeping pre-aggregations warm
 *
 * Data sources are opened per tenant through the driver factory hook, so the
 * application itself has no DataSource.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableScheduling
public class CubeOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(CubeOrchestratorApplication.class, args);
    }
}
