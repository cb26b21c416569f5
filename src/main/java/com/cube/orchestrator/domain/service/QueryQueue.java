package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.domain.exception.ContinueWaitException;
import com.cube.orchestrator.domain.exception.OrchestratorException;
import com.cube.orchestrator.domain.exception.QueryCancelledException;
import com.cube.orchestrator.domain.exception.QueryExecutionException;
import com.cube.orchestrator.domain.exception.QueryTimeoutException;
import com.cube.orchestrator.domain.exception.QueryTimeoutException.TimeoutType;
import com.cube.orchestrator.domain.hook.Hooks;
import com.cube.orchestrator.domain.model.QueryStatus;
import com.cube.orchestrator.domain.model.QueueItemStatus;
import com.cube.orchestrator.domain.model.QueueOptions;
import com.cube.orchestrator.domain.model.QueueStats;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounded, prioritized execution queue.
 *
 * Lifecycle of an item:
 * 1. enqueue: PENDING, ordered by priority (higher first), FIFO within a priority
 * 2. dispatch: RUNNING when fewer than {@code concurrency} items run
 * 3. COMPLETED / FAILED / CANCELLED, result kept until nobody polls it for {@code orphanedTimeout}
 *
 * Enqueueing a query key that is still active joins the existing item.
 *
 * Liveness (checked by {@link #reap()}):
 * - running longer than {@code executionTimeout}: failed with a timeout
 * - pending and unpolled for {@code orphanedTimeout}: cancelled as orphaned
 * - running with no heartbeat for 4 heartbeat intervals: requeued if idempotent, failed otherwise
 *
 * All time checks use the injected {@link Clock}.
 */
@Slf4j
public class QueryQueue {

    static final int HEARTBEAT_MISS_LIMIT = 4;
    static final Duration MAX_CONTINUE_WAIT = Duration.ofSeconds(90);
    private static final Duration REAP_INTERVAL = Duration.ofSeconds(1);

    private final String name;
    private final QueueOptions options;
    private final ExecutorService workers;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Object lock = new Object();
    private final Map<String, QueryQueueItem> items = new HashMap<>();
    private final PriorityQueue<QueryQueueItem> pending = new PriorityQueue<>(QueryQueueItem.DISPATCH_ORDER);
    private final Set<QueryQueueItem> running = new HashSet<>();
    private long sequence;
    private boolean shutdown;

    private final List<ScheduledFuture<?>> timers = new ArrayList<>();

    public QueryQueue(String name, QueueOptions options, ExecutorService workers, Clock clock, MeterRegistry meterRegistry) {
        if (options.getConcurrency() <= 0) {
            throw new IllegalArgumentException("Queue concurrency must be positive, got: " + options.getConcurrency());
        }
        this.name = name;
        this.options = options;
        this.workers = workers;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Starts the liveness checks and the heartbeat pump on the given scheduler.
     */
    public void start(TaskScheduler scheduler) {
        synchronized (lock) {
            timers.add(scheduler.scheduleAtFixedRate(this::reapSafely, REAP_INTERVAL));
            timers.add(scheduler.scheduleAtFixedRate(this::pumpHeartbeats, options.getHeartBeatInterval()));
        }
    }

    public String getName() {
        return name;
    }

    public QueueOptions getOptions() {
        return options;
    }

    /**
     * Adds work to the queue, or joins the active item with the same key.
     *
     * @return the handle to poll, which is the query key
     */
    public String enqueue(String queryKey, int priority, QueryTask task, boolean idempotent) {
        synchronized (lock) {
            if (shutdown) {
                throw new QueryCancelledException(queryKey);
            }
            Instant now = clock.instant();
            QueryQueueItem existing = items.get(queryKey);
            if (existing != null && !existing.getStatus().isTerminal()) {
                existing.touch(now);
                if (existing.getStatus() == QueueItemStatus.PENDING && priority > existing.getPriority()) {
                    pending.remove(existing);
                    existing.raisePriority(priority);
                    pending.add(existing);
                }
                log.debug("[{}] Joined in-flight query {}", name, queryKey);
                return queryKey;
            }
            QueryQueueItem item = new QueryQueueItem(queryKey, priority, ++sequence, task, idempotent, now);
            items.put(queryKey, item);
            pending.add(item);
            log.debug("[{}] Enqueued {} with priority {} ({} pending, {} running)",
                    name, queryKey, priority, pending.size(), running.size());
            dispatch();
            return queryKey;
        }
    }

    /**
     * Current state of an item; counts as a poll.
     */
    public Optional<QueryStatus> poll(String handle) {
        synchronized (lock) {
            QueryQueueItem item = items.get(handle);
            if (item == null) {
                return Optional.empty();
            }
            item.touch(clock.instant());
            return Optional.of(item.snapshot());
        }
    }

    /**
     * Marks an item as still wanted without waiting for it.
     */
    public void touch(String handle) {
        synchronized (lock) {
            QueryQueueItem item = items.get(handle);
            if (item != null) {
                item.touch(clock.instant());
            }
        }
    }

    /**
     * Completion of an item, for callers that want to chain on it.
     */
    public CompletableFuture<Object> resultFuture(String handle) {
        return requireItem(handle).getResult();
    }

    /**
     * Long-polls an item for up to {@code continueWait} (capped at 90 seconds).
     *
     * @throws ContinueWaitException if the item is still pending or running
     */
    public Object waitForResult(String handle, Duration continueWait) {
        QueryQueueItem item = requireItem(handle);
        touch(handle);
        Duration wait = continueWait.compareTo(MAX_CONTINUE_WAIT) > 0 ? MAX_CONTINUE_WAIT : continueWait;
        try {
            return item.getResult().get(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ContinueWaitException(handle);
        } catch (ExecutionException e) {
            throw Hooks.unwrap(e.getCause());
        } catch (CancellationException e) {
            throw new QueryCancelledException(handle);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryCancelledException(handle);
        } finally {
            touch(handle);
        }
    }

    /**
     * Blocks until the item finishes, polling it in {@code pollInterval} steps
     * so that it never looks orphaned.
     */
    public Object awaitCompletion(String handle, Duration pollInterval) {
        while (true) {
            try {
                return waitForResult(handle, pollInterval);
            } catch (ContinueWaitException e) {
                log.trace("[{}] Still waiting for {}", name, handle);
            }
        }
    }

    /**
     * Enqueues and waits for the result.
     */
    public Object executeInQueue(String queryKey, int priority, QueryTask task, boolean idempotent, Duration pollInterval) {
        String handle = enqueue(queryKey, priority, task, idempotent);
        return awaitCompletion(handle, pollInterval);
    }

    /**
     * Cancels a pending or running item. Idempotent.
     *
     * @return true if this call cancelled the item
     */
    public boolean cancel(String handle) {
        return terminate(handle, new QueryCancelledException(handle), QueueItemStatus.CANCELLED);
    }

    public QueueStats getStats() {
        synchronized (lock) {
            return new QueueStats(name, pending.size(), running.size(), options.getConcurrency());
        }
    }

    /**
     * Applies execution, orphaned and heartbeat timeouts and drops finished items
     * nobody polls anymore.
     */
    public void reap() {
        Instant now = clock.instant();
        Duration heartbeatLimit = options.getHeartBeatInterval().multipliedBy(HEARTBEAT_MISS_LIMIT);
        Settlement settlement = new Settlement();
        synchronized (lock) {
            List<QueryQueueItem> snapshot = new ArrayList<>(items.values());
            for (QueryQueueItem item : snapshot) {
                switch (item.getStatus()) {
                    case PENDING:
                        if (isOlderThan(item.getLastPolledAt(), options.getOrphanedTimeout(), now)) {
                            log.warn("[{}] Cancelling orphaned query {}: not polled for {}s",
                                    name, item.getQueryKey(), options.getOrphanedTimeout().toSeconds());
                            finish(item, new QueryTimeoutException(item.getQueryKey(), TimeoutType.ORPHANED,
                                    options.getOrphanedTimeout()), QueueItemStatus.CANCELLED, now, settlement);
                        }
                        break;
                    case RUNNING:
                        if (isOlderThan(item.getStartedAt(), options.getExecutionTimeout(), now)) {
                            log.warn("[{}] Query {} exceeded execution timeout of {}s",
                                    name, item.getQueryKey(), options.getExecutionTimeout().toSeconds());
                            finish(item, new QueryTimeoutException(item.getQueryKey(), TimeoutType.EXECUTION,
                                    options.getExecutionTimeout()), QueueItemStatus.FAILED, now, settlement);
                        } else if (isOlderThan(item.getLastHeartbeatAt(), heartbeatLimit, now)) {
                            handleLostHeartbeat(item, heartbeatLimit, now, settlement);
                        }
                        break;
                    default:
                        if (isOlderThan(item.getLastPolledAt(), options.getOrphanedTimeout(), now)) {
                            items.remove(item.getQueryKey(), item);
                        }
                        break;
                }
            }
            dispatch();
        }
        settlement.apply();
    }

    /**
     * Records a heartbeat for every running item whose worker is still alive
     * and does not report heartbeats itself.
     */
    public void pumpHeartbeats() {
        Instant now = clock.instant();
        synchronized (lock) {
            for (QueryQueueItem item : running) {
                if (!item.getTask().reportsOwnHeartbeat() && item.isWorkerAlive()) {
                    item.heartbeat(now);
                }
            }
        }
    }

    /**
     * Stops the queue: cancels timers, fails every active item and interrupts workers.
     */
    public void shutdown() {
        Settlement settlement = new Settlement();
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            timers.forEach(timer -> timer.cancel(false));
            timers.clear();
            Instant now = clock.instant();
            for (QueryQueueItem item : new ArrayList<>(items.values())) {
                if (!item.getStatus().isTerminal()) {
                    finish(item, new QueryCancelledException(item.getQueryKey()), QueueItemStatus.CANCELLED, now, settlement);
                }
            }
        }
        settlement.apply();
        workers.shutdownNow();
        log.info("[{}] Queue shut down", name);
    }

    void heartbeat(QueryQueueItem item, int attempt) {
        synchronized (lock) {
            if (item.getStatus() == QueueItemStatus.RUNNING && item.getAttempt() == attempt) {
                item.heartbeat(clock.instant());
            }
        }
    }

    boolean isCurrentAttempt(QueryQueueItem item, int attempt) {
        synchronized (lock) {
            return item.getStatus() == QueueItemStatus.RUNNING && item.getAttempt() == attempt;
        }
    }

    private boolean terminate(String handle, OrchestratorException reason, QueueItemStatus status) {
        Settlement settlement = new Settlement();
        synchronized (lock) {
            QueryQueueItem item = items.get(handle);
            if (item == null || item.getStatus().isTerminal()) {
                return false;
            }
            log.info("[{}] Cancelling query {} ({})", name, handle, item.getStatus());
            finish(item, reason, status, clock.instant(), settlement);
            dispatch();
        }
        settlement.apply();
        return true;
    }

    private void handleLostHeartbeat(QueryQueueItem item, Duration limit, Instant now, Settlement settlement) {
        if (item.isIdempotent() && item.getRequeueCount() < options.getMaxRequeues()) {
            log.warn("[{}] Query {} missed heartbeats for {}s, requeueing (attempt {})",
                    name, item.getQueryKey(), limit.toSeconds(), item.getRequeueCount() + 1);
            running.remove(item);
            settlement.abandon(item.detachWorker());
            item.requeue(now);
            pending.add(item);
        } else {
            log.warn("[{}] Query {} missed heartbeats for {}s, failing", name, item.getQueryKey(), limit.toSeconds());
            finish(item, new QueryTimeoutException(item.getQueryKey(), TimeoutType.HEARTBEAT, limit),
                    QueueItemStatus.FAILED, now, settlement);
        }
    }

    // Must hold lock
    private void finish(QueryQueueItem item, OrchestratorException reason, QueueItemStatus status,
                        Instant now, Settlement settlement) {
        if (item.getStatus() == QueueItemStatus.PENDING) {
            pending.remove(item);
        } else {
            running.remove(item);
        }
        settlement.abandon(item.detachWorker());
        item.fail(reason, status, now);
        settlement.publish(item);
    }

    // Must hold lock
    private void dispatch() {
        while (!shutdown && running.size() < options.getConcurrency() && !pending.isEmpty()) {
            QueryQueueItem item = pending.poll();
            int attempt = item.start(clock.instant());
            running.add(item);
            log.debug("[{}] Starting {} (attempt {})", name, item.getQueryKey(), attempt);
            item.attachWorker(workers.submit(() -> run(item, attempt)));
        }
    }

    private void run(QueryQueueItem item, int attempt) {
        Timer.Sample sample = Timer.start(meterRegistry);
        Object value = null;
        Throwable error = null;
        try {
            value = item.getTask().execute(new QueryTaskContext(this, item, attempt));
        } catch (Throwable t) {
            error = t;
        }
        sample.stop(Timer.builder("orchestrator.queue.execution")
                .tag("queue", name)
                .tag("result", error == null ? "success" : "error")
                .register(meterRegistry));
        onWorkerFinished(item, attempt, value, error);
    }

    private void onWorkerFinished(QueryQueueItem item, int attempt, Object value, Throwable error) {
        synchronized (lock) {
            if (item.getStatus() != QueueItemStatus.RUNNING || item.getAttempt() != attempt) {
                log.debug("[{}] Discarding outcome of stale attempt {} of {}", name, attempt, item.getQueryKey());
                return;
            }
            running.remove(item);
            item.detachWorker();
            Instant now = clock.instant();
            if (error == null) {
                item.complete(value, now);
                log.debug("[{}] Completed {}", name, item.getQueryKey());
            } else {
                OrchestratorException failure = toOrchestratorException(item.getQueryKey(), error);
                log.info("[{}] Query {} failed: {}", name, item.getQueryKey(), failure.getMessage());
                item.fail(failure, QueueItemStatus.FAILED, now);
            }
            dispatch();
        }
        item.publish();
    }

    private QueryQueueItem requireItem(String handle) {
        synchronized (lock) {
            QueryQueueItem item = items.get(handle);
            if (item == null) {
                throw new IllegalArgumentException("Unknown query handle: " + handle);
            }
            return item;
        }
    }

    private static OrchestratorException toOrchestratorException(String queryKey, Throwable error) {
        if (error instanceof OrchestratorException) {
            return (OrchestratorException) error;
        }
        if (error instanceof InterruptedException) {
            return new QueryCancelledException(queryKey);
        }
        return new QueryExecutionException("Query " + queryKey + " failed: " + error.getMessage(), error);
    }

    private static boolean isOlderThan(Instant since, Duration limit, Instant now) {
        return since != null && since.plus(limit).isBefore(now);
    }

    private void reapSafely() {
        try {
            reap();
        } catch (RuntimeException e) {
            log.error("[{}] Queue liveness check failed", name, e);
        }
    }

    int itemCount() {
        synchronized (lock) {
            return items.size();
        }
    }

    /**
     * Side effects collected under the lock and applied after releasing it:
     * interrupting abandoned workers and completing result futures.
     */
    private static final class Settlement {
        private final List<Future<?>> abandonedWorkers = new ArrayList<>();
        private final List<QueryQueueItem> finished = new ArrayList<>();

        void abandon(Future<?> worker) {
            if (worker != null) {
                abandonedWorkers.add(worker);
            }
        }

        void publish(QueryQueueItem item) {
            finished.add(item);
        }

        void apply() {
            abandonedWorkers.forEach(worker -> worker.cancel(true));
            finished.forEach(QueryQueueItem::publish);
        }
    }
}
