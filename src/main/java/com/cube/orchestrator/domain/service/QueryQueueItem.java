package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.domain.exception.OrchestratorException;
import com.cube.orchestrator.domain.model.QueryStatus;
import com.cube.orchestrator.domain.model.QueueItemStatus;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.Comparator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;

/**
 * One unit of work in a {@link QueryQueue}. Mutated only under the queue lock,
 * except for the heartbeat timestamp.
 */
@Getter
class QueryQueueItem {

    /** Higher priority first, then enqueue order. */
    static final Comparator<QueryQueueItem> DISPATCH_ORDER = Comparator
            .comparingInt(QueryQueueItem::getPriority).reversed()
            .thenComparingLong(QueryQueueItem::getSequence);

    private final String queryKey;
    private final long sequence;
    private final QueryTask task;
    private final boolean idempotent;
    private final Instant enqueuedAt;
    private final CompletableFuture<Object> result = new CompletableFuture<>();

    private int priority;
    private QueueItemStatus status = QueueItemStatus.PENDING;
    private Instant startedAt;
    private Instant finishedAt;
    private Instant lastPolledAt;
    private volatile Instant lastHeartbeatAt;
    private int attempt;
    private int requeueCount;
    private Object value;
    private OrchestratorException error;

    @Getter(AccessLevel.NONE)
    private Future<?> worker;

    QueryQueueItem(String queryKey, int priority, long sequence, QueryTask task, boolean idempotent, Instant now) {
        this.queryKey = queryKey;
        this.priority = priority;
        this.sequence = sequence;
        this.task = task;
        this.idempotent = idempotent;
        this.enqueuedAt = now;
        this.lastPolledAt = now;
    }

    void raisePriority(int newPriority) {
        if (newPriority > priority) {
            priority = newPriority;
        }
    }

    void touch(Instant now) {
        lastPolledAt = now;
    }

    int start(Instant now) {
        status = QueueItemStatus.RUNNING;
        startedAt = now;
        lastHeartbeatAt = now;
        return ++attempt;
    }

    void attachWorker(Future<?> worker) {
        this.worker = worker;
    }

    Future<?> detachWorker() {
        Future<?> detached = worker;
        worker = null;
        return detached;
    }

    boolean isWorkerAlive() {
        return worker != null && !worker.isDone();
    }

    void heartbeat(Instant now) {
        lastHeartbeatAt = now;
    }

    void requeue(Instant now) {
        status = QueueItemStatus.PENDING;
        startedAt = null;
        lastPolledAt = now;
        requeueCount++;
    }

    void complete(Object value, Instant now) {
        this.status = QueueItemStatus.COMPLETED;
        this.value = value;
        this.finishedAt = now;
        this.lastPolledAt = now;
    }

    void fail(OrchestratorException error, QueueItemStatus terminalStatus, Instant now) {
        this.status = terminalStatus;
        this.error = error;
        this.finishedAt = now;
        this.lastPolledAt = now;
    }

    /**
     * Completes the result future from the terminal state. Called outside the queue lock.
     */
    void publish() {
        if (status == QueueItemStatus.COMPLETED) {
            result.complete(value);
        } else if (status.isTerminal()) {
            result.completeExceptionally(error);
        }
    }

    QueryStatus snapshot() {
        return QueryStatus.builder()
                .queryKey(queryKey)
                .status(status)
                .priority(priority)
                .result(value)
                .error(error != null ? error.getMessage() : null)
                .errorKind(error != null ? error.getKind() : null)
                .enqueuedAt(enqueuedAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .requeueCount(requeueCount)
                .build();
    }
}
