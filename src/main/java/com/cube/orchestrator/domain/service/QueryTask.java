package com.cube.orchestrator.domain.service;

/**
 * Unit of work executed by a {@link QueryQueue} worker.
 *
 * By default the queue reports heartbeats for the worker while it runs.
 * Tasks that run somewhere the queue cannot observe report their own
 * liveness through {@link QueryTaskContext#heartbeat()} and return true
 * from {@link #reportsOwnHeartbeat()}.
 */
@FunctionalInterface
public interface QueryTask {

    Object execute(QueryTaskContext context) throws Exception;

    default boolean reportsOwnHeartbeat() {
        return false;
    }
}
