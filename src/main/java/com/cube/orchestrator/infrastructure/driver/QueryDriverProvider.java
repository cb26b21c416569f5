package com.cube.orchestrator.infrastructure.driver;

/**
 * Opens a {@link QueryDriver} from validated connection parameters.
 */
@FunctionalInterface
public interface QueryDriverProvider {

    QueryDriver open(DriverConfig config, int poolSize);
}
