package com.cube.orchestrator.domain.hook;

import com.cube.orchestrator.domain.model.RequestContext;

import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * Supplies connection parameters of a data source.
 *
 * Called once per orchestrator instance and data source. The result is a
 * plain configuration map; see {@code DriverConfig} for the accepted keys.
 */
@FunctionalInterface
public interface DriverFactory {

    CompletionStage<Map<String, Object>> driverConfig(RequestContext context, String dataSource);
}
