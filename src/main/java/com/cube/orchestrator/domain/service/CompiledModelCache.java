package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.domain.hook.Hooks;
import com.cube.orchestrator.domain.hook.ModelCompiler;
import com.cube.orchestrator.domain.hook.RepositoryFactory;
import com.cube.orchestrator.domain.model.CompiledModel;
import com.cube.orchestrator.domain.model.ModelFile;
import com.cube.orchestrator.domain.model.RequestContext;
import com.cube.orchestrator.infrastructure.cache.BoundedLruCache;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compiled data models per app id, bounded LRU.
 *
 * An entry is reused while the schema version of its app id stays the same;
 * a new version recompiles and replaces it. With a keep-alive configured,
 * entries also expire after that long (since compilation, or since last use
 * when renewal on access is enabled).
 *
 * Compilation is exclusive per app id and independent of the orchestrator registry.
 */
@Slf4j
public class CompiledModelCache {

    private final BoundedLruCache<String, Entry> cache;
    private final Map<String, Object> compileLocks = new ConcurrentHashMap<>();
    private final RepositoryFactory repositoryFactory;
    private final ModelCompiler modelCompiler;
    private final Duration keepAlive;
    private final boolean renewKeepAlive;
    private final Clock clock;

    public CompiledModelCache(int maxSize, Duration keepAlive, boolean renewKeepAlive,
                              RepositoryFactory repositoryFactory, ModelCompiler modelCompiler, Clock clock) {
        this.cache = new BoundedLruCache<>(maxSize);
        this.keepAlive = keepAlive;
        this.renewKeepAlive = renewKeepAlive;
        this.repositoryFactory = repositoryFactory;
        this.modelCompiler = modelCompiler;
        this.clock = clock;
    }

    public CompiledModel getOrCompile(String appId, String version, RequestContext context) {
        while (true) {
            CompiledModel cached = lookup(appId, version);
            if (cached != null) {
                return cached;
            }
            Object lock = compileLocks.computeIfAbsent(appId, key -> new Object());
            synchronized (lock) {
                // a lock is only valid while mapped; the compiling thread unmaps it when done
                if (compileLocks.get(appId) != lock) {
                    continue;
                }
                try {
                    cached = lookup(appId, version);
                    if (cached != null) {
                        return cached;
                    }
                    return compile(appId, version, context);
                } finally {
                    compileLocks.remove(appId, lock);
                }
            }
        }
    }

    /**
     * Forgets the model of an app id so that the next request recompiles it.
     */
    public void invalidate(String appId) {
        if (cache.remove(appId) != null) {
            log.info("Invalidated compiled data model of app {}", appId);
        }
    }

    public boolean contains(String appId) {
        return cache.containsKey(appId);
    }

    public int size() {
        return cache.size();
    }

    int pendingCompilations() {
        return compileLocks.size();
    }

    private CompiledModel compile(String appId, String version, RequestContext context) {
        log.info("Compiling data model of app {} (version {})", appId, version);
        List<ModelFile> files = Hooks.await(repositoryFactory.modelFiles(context));
        CompiledModel model = Hooks.await(modelCompiler.compile(appId, version, files));
        cache.put(appId, new Entry(version, model, expiry(clock.instant())));
        log.info("Compiled data model of app {}: {} pre-aggregation(s), {}",
                appId, model.getPreAggregations().size(), cache.getStats());
        return model;
    }

    private CompiledModel lookup(String appId, String version) {
        Entry entry = cache.get(appId);
        if (entry == null || !entry.version.equals(version)) {
            return null;
        }
        Instant now = clock.instant();
        if (entry.isExpired(now)) {
            log.debug("Compiled data model of app {} expired", appId);
            cache.remove(appId, entry);
            return null;
        }
        if (renewKeepAlive) {
            entry.expiresAt = expiry(now);
        }
        return entry.model;
    }

    private Instant expiry(Instant from) {
        return keepAlive != null ? from.plus(keepAlive) : null;
    }

    private static final class Entry {
        private final String version;
        private final CompiledModel model;
        private volatile Instant expiresAt;

        private Entry(String version, CompiledModel model, Instant expiresAt) {
            this.version = version;
            this.model = model;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
