package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.domain.model.RequestContext;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link OrchestratorInstance} per orchestrator key.
 *
 * Instances are created on first use and kept until evicted. Creation holds a
 * lock for that key only, so a slow tenant never delays the others.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrchestratorRegistry {

    private final OrchestratorInstanceFactory instanceFactory;

    private final Map<String, OrchestratorInstance> instances = new ConcurrentHashMap<>();
    private final Map<String, Object> creationLocks = new ConcurrentHashMap<>();

    public OrchestratorInstance getOrCreate(String orchestratorId, RequestContext context) {
        while (true) {
            OrchestratorInstance instance = instances.get(orchestratorId);
            if (instance != null) {
                return instance;
            }
            Object lock = creationLocks.computeIfAbsent(orchestratorId, key -> new Object());
            synchronized (lock) {
                // a lock is only valid while mapped; the creator unmaps it when done
                if (creationLocks.get(orchestratorId) != lock) {
                    continue;
                }
                try {
                    instance = instances.get(orchestratorId);
                    if (instance == null) {
                        instance = instanceFactory.create(orchestratorId, context);
                        instances.put(orchestratorId, instance);
                    }
                    return instance;
                } finally {
                    creationLocks.remove(orchestratorId, lock);
                }
            }
        }
    }

    /**
     * Removes and shuts down the instance of a key. The next request creates a fresh one.
     */
    public boolean evict(String orchestratorId) {
        OrchestratorInstance instance = instances.remove(orchestratorId);
        if (instance == null) {
            return false;
        }
        log.info("Evicting orchestrator {}", orchestratorId);
        instance.shutdown();
        return true;
    }

    int pendingCreations() {
        return creationLocks.size();
    }

    public Set<String> getOrchestratorIds() {
        return Set.copyOf(instances.keySet());
    }

    public int size() {
        return instances.size();
    }

    @PreDestroy
    public void shutdown() {
        List<String> ids = new ArrayList<>(instances.keySet());
        log.info("Shutting down {} orchestrator instance(s)", ids.size());
        ids.forEach(this::evict);
    }
}
