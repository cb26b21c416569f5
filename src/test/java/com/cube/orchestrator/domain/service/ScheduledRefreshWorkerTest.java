package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.config.OrchestratorProperties;
import com.cube.orchestrator.domain.exception.QueryExecutionException;
import com.cube.orchestrator.domain.hook.ScheduledRefreshContexts;
import com.cube.orchestrator.domain.model.RefreshSummary;
import com.cube.orchestrator.domain.model.RequestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScheduledRefreshWorkerTest {

    @Mock
    private OrchestratorService orchestratorService;

    private OrchestratorProperties properties;
    private final RequestContext acme = RequestContext.of(Map.of("tenant", "acme"));
    private final RequestContext globex = RequestContext.of(Map.of("tenant", "globex"));

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        properties.getScheduledRefresh().setEnabled(true);
        properties.getScheduledRefresh().setTimezones(List.of("UTC", "America/New_York"));
    }

    private ScheduledRefreshWorker worker(ScheduledRefreshContexts contexts) {
        return new ScheduledRefreshWorker(orchestratorService, contexts, properties);
    }

    private ScheduledRefreshContexts contexts(RequestContext... contexts) {
        return () -> CompletableFuture.completedFuture(List.of(contexts));
    }

    @Test
    void testRunOnce_RefreshesEveryContextInEveryTimezone() {
        // Given
        when(orchestratorService.refreshPreAggregations(any(), any())).thenReturn(2);

        // When
        RefreshSummary summary = worker(contexts(acme, globex)).runOnce();

        // Then
        assertFalse(summary.isSkipped());
        assertEquals(2, summary.getContexts());
        assertEquals(2, summary.getTimezones());
        assertEquals(8, summary.getPartitions());
        assertEquals(0, summary.getFailures());
        verify(orchestratorService).refreshPreAggregations(acme, ZoneId.of("America/New_York"));
        verify(orchestratorService).refreshPreAggregations(globex, ZoneId.of("UTC"));
    }

    @Test
    void testRunOnce_FailingContextDoesNotStopOthers() {
        // Given
        when(orchestratorService.refreshPreAggregations(eq(acme), any()))
                .thenThrow(new QueryExecutionException("build failed", new IllegalStateException("disk full")));
        when(orchestratorService.refreshPreAggregations(eq(globex), any())).thenReturn(1);

        // When
        RefreshSummary summary = worker(contexts(acme, globex)).runOnce();

        // Then
        assertEquals(2, summary.getFailures());
        assertEquals(2, summary.getPartitions());
    }

    @Test
    void testRunOnce_InvalidTimezoneIsSkipped() {
        // Given
        properties.getScheduledRefresh().setTimezones(List.of("Mars/Olympus_Mons", "UTC"));
        when(orchestratorService.refreshPreAggregations(any(), any())).thenReturn(3);

        // When
        RefreshSummary summary = worker(contexts(acme, globex)).runOnce();

        // Then
        assertEquals(2, summary.getFailures());
        assertEquals(6, summary.getPartitions());
        verify(orchestratorService).refreshPreAggregations(acme, ZoneId.of("UTC"));
        verify(orchestratorService).refreshPreAggregations(globex, ZoneId.of("UTC"));
    }

    @Test
    void testRunOnce_ContextsHookFailure() {
        RefreshSummary summary = worker(() -> CompletableFuture.failedFuture(new IllegalStateException("tenant db down")))
                .runOnce();

        assertEquals(1, summary.getFailures());
        verifyNoInteractions(orchestratorService);
    }

    @Test
    void testRunOnce_NoContexts() {
        RefreshSummary summary = worker(contexts()).runOnce();

        assertEquals(0, summary.getContexts());
        verifyNoInteractions(orchestratorService);
    }

    @Test
    void testTick_DisabledDoesNothing() {
        properties.getScheduledRefresh().setEnabled(false);

        worker(contexts(acme)).tick();

        verifyNoInteractions(orchestratorService);
    }

    @Test
    void testRunOnce_OverlappingPassIsSkipped() throws Exception {
        // Given
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(orchestratorService.refreshPreAggregations(any(), any())).thenAnswer(invocation -> {
            started.countDown();
            release.await();
            return 1;
        });
        ScheduledRefreshWorker worker = worker(contexts(acme));
        ExecutorService executor = Executors.newSingleThreadExecutor();

        try {
            // When
            Future<RefreshSummary> first = executor.submit(worker::runOnce);
            assertTrue(started.await(5, TimeUnit.SECONDS));
            RefreshSummary overlapping = worker.runOnce();
            release.countDown();

            // Then
            assertTrue(overlapping.isSkipped());
            assertFalse(first.get(5, TimeUnit.SECONDS).isSkipped());
            assertFalse(worker.isRunning());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }
}
