package com.cube.orchestrator.config;

import com.cube.orchestrator.domain.model.QueueOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings bound from the {@code cube.*} namespace of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "cube")
public class OrchestratorProperties {

    /** "memory" or "redis". */
    private String cacheAndQueueDriver = "memory";

    private String preAggregationsSchema = "pre_aggregations";

    private int compilerCacheSize = 250;

    /** Null keeps compiled models until evicted by size. */
    private Duration maxCompilerCacheKeepAlive;

    private boolean updateCompilerCacheKeepAlive;

    /** Directory the default repository reads model files from. */
    private String schemaPath = "model";

    /** Connection settings per data source used by the default driver factory. */
    private Map<String, Map<String, Object>> dataSources = new HashMap<>();

    private Orchestrator orchestrator = new Orchestrator();

    private ScheduledRefresh scheduledRefresh = new ScheduledRefresh();

    @Data
    public static class Orchestrator {

        private Duration continueWaitTimeout = Duration.ofSeconds(5);

        private boolean rollupOnlyMode;

        /** Statement timeout applied by JDBC drivers. */
        private Duration queryTimeout = Duration.ofMinutes(10);

        private QueryCache queryCache = new QueryCache();

        private PreAggregations preAggregations = new PreAggregations();
    }

    @Data
    public static class QueryCache {

        private Duration refreshKeyRenewalThreshold = Duration.ofSeconds(10);

        private boolean backgroundRenew;

        private Duration expireAfter = Duration.ofHours(24);

        private QueueOptions queue = new QueueOptions();
    }

    @Data
    public static class PreAggregations {

        private Duration refreshKeyRenewalThreshold = Duration.ofSeconds(10);

        private boolean externalRefresh;

        private int maxPartitions = 10000;

        private QueueOptions queue = new QueueOptions();
    }

    @Data
    public static class ScheduledRefresh {

        private boolean enabled;

        private Duration timer = Duration.ofSeconds(30);

        private List<String> timezones = new ArrayList<>(List.of("UTC"));
    }
}
