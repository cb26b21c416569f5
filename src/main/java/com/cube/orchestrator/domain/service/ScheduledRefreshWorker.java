package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.config.OrchestratorProperties;
import com.cube.orchestrator.domain.hook.Hooks;
import com.cube.orchestrator.domain.hook.ScheduledRefreshContexts;
import com.cube.orchestrator.domain.model.RefreshSummary;
import com.cube.orchestrator.domain.model.RequestContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically builds pre-aggregations for every tenant so that queries find them ready.
 *
 * Processing Flow:
 * 1. Fire every {@code cube.scheduled-refresh.timer} (only when enabled)
 * 2. Ask the contexts hook for the tenants to refresh
 * 3. For each time zone and context, refresh all pre-aggregations of its data model
 *
 * Failure Handling:
 * - A tick that starts while the previous one still runs is skipped
 * - A failing context is logged and the tick moves on to the next one
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduledRefreshWorker {

    private final OrchestratorService orchestratorService;
    private final ScheduledRefreshContexts scheduledRefreshContexts;
    private final OrchestratorProperties properties;

    private final AtomicBoolean running = new AtomicBoolean();

    @Scheduled(fixedRateString = "${cube.scheduled-refresh.timer:PT30S}",
            initialDelayString = "${cube.scheduled-refresh.timer:PT30S}")
    public void tick() {
        if (!properties.getScheduledRefresh().isEnabled()) {
            return;
        }
        runOnce();
    }

    /**
     * Runs one refresh pass now, unless one is already in progress.
     */
    public RefreshSummary runOnce() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Scheduled refresh still running, skipping this tick");
            return RefreshSummary.skipped();
        }
        try {
            return refreshAll();
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private RefreshSummary refreshAll() {
        List<RequestContext> contexts;
        try {
            contexts = Hooks.await(scheduledRefreshContexts.contexts());
        } catch (RuntimeException e) {
            log.error("Scheduled refresh contexts hook failed", e);
            return RefreshSummary.builder().failures(1).build();
        }
        List<String> timezones = properties.getScheduledRefresh().getTimezones();
        if (contexts == null || contexts.isEmpty()) {
            log.warn("Scheduled refresh is enabled but no contexts are configured, nothing to refresh");
            return RefreshSummary.builder().timezones(timezones.size()).build();
        }

        log.info("Scheduled refresh: {} context(s) x {} time zone(s)", contexts.size(), timezones.size());
        int partitions = 0;
        int failures = 0;
        for (String timezone : timezones) {
            ZoneId zone;
            try {
                zone = ZoneId.of(timezone);
            } catch (DateTimeException e) {
                failures += contexts.size();
                log.error("Skipping invalid scheduled refresh time zone '{}': {}", timezone, e.getMessage());
                continue;
            }
            for (RequestContext context : contexts) {
                try {
                    partitions += orchestratorService.refreshPreAggregations(context, zone);
                } catch (RuntimeException e) {
                    failures++;
                    log.error("Scheduled refresh failed for context {} in {}", context.getSecurityContext(), timezone, e);
                }
            }
        }
        log.info("Scheduled refresh done: {} partition(s) up to date, {} failure(s)", partitions, failures);
        return RefreshSummary.builder()
                .contexts(contexts.size())
                .timezones(timezones.size())
                .partitions(partitions)
                .failures(failures)
                .build();
    }
}
