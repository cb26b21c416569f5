package com.cube.orchestrator.api;

import com.cube.orchestrator.domain.exception.ContinueWaitException;
import com.cube.orchestrator.domain.model.LoadResponse;
import com.cube.orchestrator.domain.model.QueryStatus;
import com.cube.orchestrator.domain.model.RefreshSummary;
import com.cube.orchestrator.domain.model.RequestContext;
import com.cube.orchestrator.domain.service.OrchestratorService;
import com.cube.orchestrator.domain.service.ScheduledRefreshWorker;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

/**
 * REST API of the orchestrator.
 *
 * Endpoints:
 * - POST /api/v1/orchestrator/load - Load a query result (long-poll)
 * - GET /api/v1/orchestrator/queries/{handle} - Poll a queued query
 * - DELETE /api/v1/orchestrator/queries/{handle} - Cancel a queued query
 * - POST /api/v1/orchestrator/pre-aggregations/refresh - Run a scheduled refresh pass now
 * - GET /api/v1/orchestrator/health - Health check
 *
 * Every endpoint except health goes through the auth hook with the Authorization header.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/orchestrator")
@RequiredArgsConstructor
public class OrchestratorController {

    private final OrchestratorService orchestratorService;
    private final ScheduledRefreshWorker scheduledRefreshWorker;

    /**
     * Load a query result.
     *
     * POST /api/v1/orchestrator/load
     *
     * Request body:
     * {
     *   "query": { "sql": "...", "params": [...], "dataSource": "default", "refreshKeys": [...],
     *              "preAggregations": [...], "timezone": "UTC", "renewQuery": false },
     *   "continueWait": "PT5S"
     * }
     *
     * Response:
     * - 200 with the result, or 200 {"error": "Continue wait"} while it is still running;
     *   the client repeats the same request to keep waiting
     */
    @PostMapping("/load")
    public ResponseEntity<?> load(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody LoadRequest request) {

        RequestContext context = orchestratorService.authenticate(authorization);
        context.setRequestId(UUID.randomUUID().toString());
        log.info("Load query: requestId={}, dataSource={}", context.getRequestId(), request.getQuery().getDataSource());

        try {
            LoadResponse response = orchestratorService.load(context, request.getQuery(), request.getContinueWait());
            return ResponseEntity.ok(response);
        } catch (ContinueWaitException e) {
            log.debug("Load query: requestId={} continues waiting on {}", context.getRequestId(), e.getQueryKey());
            return ResponseEntity.ok(ErrorResponse.continueWait(e.getQueryKey()));
        }
    }

    /**
     * Poll a queued query.
     *
     * GET /api/v1/orchestrator/queries/{handle}
     */
    @GetMapping("/queries/{handle}")
    public ResponseEntity<QueryStatus> queryStatus(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String handle) {

        RequestContext context = orchestratorService.authenticate(authorization);
        return orchestratorService.queryStatus(context, handle)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Cancel a queued query. Cancelling a finished or unknown query is a no-op.
     *
     * DELETE /api/v1/orchestrator/queries/{handle}
     */
    @DeleteMapping("/queries/{handle}")
    public ResponseEntity<Map<String, Object>> cancel(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String handle) {

        RequestContext context = orchestratorService.authenticate(authorization);
        boolean cancelled = orchestratorService.cancel(context, handle);
        log.info("Cancel query {}: {}", handle, cancelled ? "cancelled" : "not active");
        return ResponseEntity.ok(Map.of("queryKey", handle, "cancelled", cancelled));
    }

    /**
     * Run one scheduled refresh pass now, over every context and time zone.
     *
     * POST /api/v1/orchestrator/pre-aggregations/refresh
     */
    @PostMapping("/pre-aggregations/refresh")
    public ResponseEntity<RefreshSummary> refreshPreAggregations(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {

        orchestratorService.authenticate(authorization);
        log.info("Manual pre-aggregation refresh requested");
        return ResponseEntity.ok(scheduledRefreshWorker.runOnce());
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
