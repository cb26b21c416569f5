package com.cube.orchestrator.domain.service;

/**
 * Handle given to a running task for one execution attempt.
 */
public class QueryTaskContext {

    private final QueryQueue queue;
    private final QueryQueueItem item;
    private final int attempt;

    QueryTaskContext(QueryQueue queue, QueryQueueItem item, int attempt) {
        this.queue = queue;
        this.item = item;
        this.attempt = attempt;
    }

    public String getQueryKey() {
        return item.getQueryKey();
    }

    public int getAttempt() {
        return attempt;
    }

    /**
     * Reports that the worker is alive.
     */
    public void heartbeat() {
        queue.heartbeat(item, attempt);
    }

    /**
     * True once this attempt was cancelled, timed out or requeued.
     */
    public boolean isCancelled() {
        return !queue.isCurrentAttempt(item, attempt);
    }
}
