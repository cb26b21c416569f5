package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.domain.exception.ContinueWaitException;
import com.cube.orchestrator.domain.exception.ErrorKind;
import com.cube.orchestrator.domain.exception.QueryCancelledException;
import com.cube.orchestrator.domain.exception.QueryExecutionException;
import com.cube.orchestrator.domain.exception.QueryTimeoutException;
import com.cube.orchestrator.domain.model.QueryStatus;
import com.cube.orchestrator.domain.model.QueueItemStatus;
import com.cube.orchestrator.domain.model.QueueOptions;
import com.cube.orchestrator.domain.model.QueueStats;
import com.cube.orchestrator.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for QueryQueue.
 *
 * Liveness is driven by calling reap() with a manually advanced clock,
 * the queue is never started on a scheduler here.
 */
class QueryQueueTest {

    private static final Duration POLL = Duration.ofMillis(20);

    private MutableClock clock;
    private QueueOptions options;
    private QueryQueue queue;
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        options = new QueueOptions();
        options.setConcurrency(2);
        options.setExecutionTimeout(Duration.ofSeconds(600));
        options.setOrphanedTimeout(Duration.ofSeconds(120));
        options.setHeartBeatInterval(Duration.ofSeconds(60));
        queue = newQueue(options);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        queue.shutdown();
    }

    private QueryQueue newQueue(QueueOptions queueOptions) {
        return new QueryQueue("test", queueOptions, Executors.newCachedThreadPool(), clock, new SimpleMeterRegistry());
    }

    private QueryTask blocking(Object value) {
        return context -> {
            release.await();
            return value;
        };
    }

    @Test
    void testEnqueue_RunsAtMostConcurrencyItems() {
        // When
        queue.enqueue("q1", 0, blocking("r1"), true);
        queue.enqueue("q2", 0, blocking("r2"), true);
        queue.enqueue("q3", 0, blocking("r3"), true);

        // Then
        QueueStats stats = queue.getStats();
        assertEquals(2, stats.getRunning());
        assertEquals(1, stats.getPending());
        assertEquals(QueueItemStatus.PENDING, queue.poll("q3").orElseThrow().getStatus());

        release.countDown();
        assertEquals("r3", queue.awaitCompletion("q3", POLL));
        assertEquals("r1", queue.awaitCompletion("q1", POLL));
        assertEquals(0, queue.getStats().getRunning());
    }

    @Test
    void testDispatch_HigherPriorityFirstThenFifo() throws Exception {
        // Given
        options.setConcurrency(1);
        queue = newQueue(options);
        List<String> order = new CopyOnWriteArrayList<>();
        queue.enqueue("blocker", 0, blocking("done"), true);

        // When
        queue.enqueue("low-1", 1, context -> order.add("low-1"), true);
        queue.enqueue("low-2", 1, context -> order.add("low-2"), true);
        queue.enqueue("high", 10, context -> order.add("high"), true);
        release.countDown();
        queue.awaitCompletion("low-2", POLL);

        // Then
        assertEquals(List.of("high", "low-1", "low-2"), order);
    }

    @Test
    void testEnqueue_SameKeyJoinsActiveItem() {
        // Given
        AtomicInteger executions = new AtomicInteger();
        QueryTask task = context -> {
            executions.incrementAndGet();
            release.await();
            return 42;
        };

        // When
        String first = queue.enqueue("same", 0, task, true);
        String second = queue.enqueue("same", 0, task, true);
        release.countDown();

        // Then
        assertEquals(first, second);
        assertEquals(42, queue.awaitCompletion(first, POLL));
        assertEquals(1, executions.get());
    }

    @Test
    void testEnqueue_JoiningRaisesPendingPriority() {
        // Given
        options.setConcurrency(1);
        queue = newQueue(options);
        queue.enqueue("blocker", 0, blocking("done"), true);
        queue.enqueue("q", 1, blocking("r"), true);

        // When
        queue.enqueue("q", 5, blocking("r"), true);

        // Then
        assertEquals(5, queue.poll("q").orElseThrow().getPriority());
    }

    @Test
    void testWaitForResult_ContinueWaitWhileRunning() {
        // Given
        String handle = queue.enqueue("slow", 0, blocking("r"), true);

        // When / Then
        ContinueWaitException e = assertThrows(ContinueWaitException.class,
                () -> queue.waitForResult(handle, Duration.ofMillis(50)));
        assertEquals("slow", e.getQueryKey());
        assertEquals(ErrorKind.CONTINUE_WAIT, e.getKind());
        assertEquals(QueueItemStatus.RUNNING, queue.poll(handle).orElseThrow().getStatus());
    }

    @Test
    void testWaitForResult_TaskFailureSurfacesAsQueryFailed() {
        // Given
        String handle = queue.enqueue("broken", 0, context -> {
            throw new IllegalStateException("relation does not exist");
        }, true);

        // When
        QueryExecutionException e = assertThrows(QueryExecutionException.class,
                () -> queue.awaitCompletion(handle, POLL));

        // Then
        assertTrue(e.getMessage().contains("relation does not exist"));
        QueryStatus status = queue.poll(handle).orElseThrow();
        assertEquals(QueueItemStatus.FAILED, status.getStatus());
        assertEquals(ErrorKind.QUERY_FAILED, status.getErrorKind());
    }

    @Test
    void testCancel_IsIdempotent() {
        // Given
        options.setConcurrency(1);
        queue = newQueue(options);
        queue.enqueue("blocker", 0, blocking("done"), true);
        String handle = queue.enqueue("pending", 0, blocking("r"), true);

        // When
        boolean first = queue.cancel(handle);
        boolean second = queue.cancel(handle);

        // Then
        assertTrue(first);
        assertFalse(second);
        assertFalse(queue.cancel("unknown"));
        assertThrows(QueryCancelledException.class, () -> queue.waitForResult(handle, POLL));
        assertEquals(QueueItemStatus.CANCELLED, queue.poll(handle).orElseThrow().getStatus());
    }

    @Test
    void testCancel_RunningItemFreesSlot() {
        // Given
        options.setConcurrency(1);
        queue = newQueue(options);
        queue.enqueue("running", 0, blocking("r"), true);
        queue.enqueue("next", 0, context -> "next-result", true);

        // When
        assertTrue(queue.cancel("running"));

        // Then
        assertEquals("next-result", queue.awaitCompletion("next", POLL));
    }

    @Test
    void testReap_ExecutionTimeoutFailsRunningItem() {
        // Given
        String handle = queue.enqueue("long", 0, blocking("r"), true);

        // When
        clock.advance(Duration.ofSeconds(601));
        queue.reap();

        // Then
        QueryTimeoutException e = assertThrows(QueryTimeoutException.class, () -> queue.waitForResult(handle, POLL));
        assertEquals(QueryTimeoutException.TimeoutType.EXECUTION, e.getType());
        assertTrue(e.isRetryable());
        assertEquals(QueueItemStatus.FAILED, queue.poll(handle).orElseThrow().getStatus());
    }

    @Test
    void testReap_UnpolledPendingItemIsOrphaned() {
        // Given
        options.setConcurrency(1);
        queue = newQueue(options);
        queue.enqueue("blocker", 0, blocking("done"), true);
        String handle = queue.enqueue("forgotten", 0, blocking("r"), true);

        // When
        clock.advance(Duration.ofSeconds(121));
        queue.reap();

        // Then
        QueryStatus status = queue.poll(handle).orElseThrow();
        assertEquals(QueueItemStatus.CANCELLED, status.getStatus());
        assertEquals(ErrorKind.TIMEOUT, status.getErrorKind());
        assertEquals(QueueItemStatus.RUNNING, queue.poll("blocker").orElseThrow().getStatus());
    }

    @Test
    void testReap_PolledPendingItemIsKept() {
        // Given
        options.setConcurrency(1);
        queue = newQueue(options);
        queue.enqueue("blocker", 0, blocking("done"), true);
        String handle = queue.enqueue("watched", 0, blocking("r"), true);

        // When
        clock.advance(Duration.ofSeconds(100));
        queue.touch(handle);
        clock.advance(Duration.ofSeconds(100));
        queue.reap();

        // Then
        assertEquals(QueueItemStatus.PENDING, queue.poll(handle).orElseThrow().getStatus());
    }

    @Test
    void testReap_LostHeartbeatRequeuesIdempotentItem() {
        // Given
        String handle = queue.enqueue("idempotent", 0, blocking("r"), true);

        // When
        clock.advance(Duration.ofSeconds(241));
        queue.reap();

        // Then
        QueryStatus status = queue.poll(handle).orElseThrow();
        assertEquals(QueueItemStatus.RUNNING, status.getStatus());
        assertEquals(1, status.getRequeueCount());

        release.countDown();
        assertEquals("r", queue.awaitCompletion(handle, POLL));
    }

    @Test
    void testReap_LostHeartbeatFailsNonIdempotentItem() {
        // Given
        String handle = queue.enqueue("build", 0, blocking("r"), false);

        // When
        clock.advance(Duration.ofSeconds(241));
        queue.reap();

        // Then
        QueryTimeoutException e = assertThrows(QueryTimeoutException.class, () -> queue.waitForResult(handle, POLL));
        assertEquals(QueryTimeoutException.TimeoutType.HEARTBEAT, e.getType());
    }

    @Test
    void testReap_RequeueLimitFailsItem() {
        // Given
        options.setMaxRequeues(1);
        queue = newQueue(options);
        String handle = queue.enqueue("flaky", 0, blocking("r"), true);

        // When
        clock.advance(Duration.ofSeconds(241));
        queue.reap();
        clock.advance(Duration.ofSeconds(241));
        queue.reap();

        // Then
        QueryTimeoutException e = assertThrows(QueryTimeoutException.class, () -> queue.waitForResult(handle, POLL));
        assertEquals(QueryTimeoutException.TimeoutType.HEARTBEAT, e.getType());
        assertEquals(1, queue.poll(handle).orElseThrow().getRequeueCount());
    }

    @Test
    void testPumpHeartbeats_KeepsLiveWorkerRunning() throws Exception {
        // Given
        CountDownLatch started = new CountDownLatch(1);
        String handle = queue.enqueue("live", 0, context -> {
            started.countDown();
            release.await();
            return "r";
        }, false);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        // When
        clock.advance(Duration.ofSeconds(200));
        queue.pumpHeartbeats();
        clock.advance(Duration.ofSeconds(200));
        queue.reap();

        // Then
        assertEquals(QueueItemStatus.RUNNING, queue.poll(handle).orElseThrow().getStatus());
    }

    @Test
    void testReap_DropsFinishedItemsNobodyPolls() {
        // Given
        String handle = queue.enqueue("quick", 0, context -> "r", true);
        assertEquals("r", queue.awaitCompletion(handle, POLL));

        // When
        clock.advance(Duration.ofSeconds(121));
        queue.reap();

        // Then
        assertTrue(queue.poll(handle).isEmpty());
        assertEquals(0, queue.itemCount());
    }

    @Test
    void testShutdown_CancelsActiveItemsAndRejectsNewOnes() {
        // Given
        String handle = queue.enqueue("active", 0, blocking("r"), true);

        // When
        queue.shutdown();

        // Then
        assertThrows(QueryCancelledException.class, () -> queue.waitForResult(handle, POLL));
        assertThrows(QueryCancelledException.class, () -> queue.enqueue("late", 0, blocking("r"), true));
    }

    @Test
    void testConstructor_RejectsZeroConcurrency() {
        QueueOptions invalid = new QueueOptions();
        invalid.setConcurrency(0);

        assertThrows(IllegalArgumentException.class, () -> newQueue(invalid));
    }
}
