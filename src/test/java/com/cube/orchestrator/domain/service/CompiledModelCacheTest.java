package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.domain.hook.ModelCompiler;
import com.cube.orchestrator.domain.hook.RepositoryFactory;
import com.cube.orchestrator.domain.model.CompiledModel;
import com.cube.orchestrator.domain.model.ModelFile;
import com.cube.orchestrator.domain.model.RequestContext;
import com.cube.orchestrator.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CompiledModelCacheTest {

    @Mock
    private RepositoryFactory repositoryFactory;

    @Mock
    private ModelCompiler modelCompiler;

    private MutableClock clock;
    private final RequestContext context = RequestContext.of(Map.of("tenant", "a"));

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        lenient().when(repositoryFactory.modelFiles(any()))
                .thenReturn(CompletableFuture.completedFuture(List.of(new ModelFile("orders.json", "{}"))));
        lenient().when(modelCompiler.compile(anyString(), anyString(), anyList())).thenAnswer(invocation ->
                CompletableFuture.completedFuture(CompiledModel.builder()
                        .appId(invocation.getArgument(0))
                        .version(invocation.getArgument(1))
                        .compiledAt(clock.instant())
                        .build()));
    }

    private CompiledModelCache cache(int maxSize, Duration keepAlive, boolean renew) {
        return new CompiledModelCache(maxSize, keepAlive, renew, repositoryFactory, modelCompiler, clock);
    }

    @Test
    void testGetOrCompile_ReusesModelOfSameVersion() {
        CompiledModelCache cache = cache(10, null, false);

        CompiledModel first = cache.getOrCompile("app-a", "1", context);
        CompiledModel second = cache.getOrCompile("app-a", "1", context);

        assertSame(first, second);
        verify(modelCompiler, times(1)).compile(eq("app-a"), eq("1"), anyList());
        verify(repositoryFactory, times(1)).modelFiles(context);
    }

    @Test
    void testGetOrCompile_NewVersionRecompiles() {
        CompiledModelCache cache = cache(10, null, false);

        cache.getOrCompile("app-a", "1", context);
        CompiledModel updated = cache.getOrCompile("app-a", "2", context);

        assertEquals("2", updated.getVersion());
        assertEquals(1, cache.size());
    }

    @Test
    void testGetOrCompile_LeastRecentlyUsedAppIsEvicted() {
        // Given
        CompiledModelCache cache = cache(2, null, false);
        cache.getOrCompile("A", "1", context);
        cache.getOrCompile("B", "1", context);

        // When
        cache.getOrCompile("C", "1", context);

        // Then
        assertFalse(cache.contains("A"));
        assertTrue(cache.contains("B"));
        assertTrue(cache.contains("C"));
    }

    @Test
    void testGetOrCompile_AccessProtectsFromEviction() {
        // Given
        CompiledModelCache cache = cache(2, null, false);
        cache.getOrCompile("A", "1", context);
        cache.getOrCompile("B", "1", context);

        // When
        cache.getOrCompile("A", "1", context);
        cache.getOrCompile("C", "1", context);

        // Then
        assertTrue(cache.contains("A"));
        assertFalse(cache.contains("B"));
    }

    @Test
    void testGetOrCompile_KeepAliveExpiresEntry() {
        CompiledModelCache cache = cache(10, Duration.ofMinutes(10), false);

        cache.getOrCompile("app-a", "1", context);
        clock.advance(Duration.ofMinutes(5));
        cache.getOrCompile("app-a", "1", context);
        clock.advance(Duration.ofMinutes(6));
        cache.getOrCompile("app-a", "1", context);

        verify(modelCompiler, times(2)).compile(eq("app-a"), eq("1"), anyList());
    }

    @Test
    void testGetOrCompile_RenewedKeepAliveSurvivesActiveUse() {
        CompiledModelCache cache = cache(10, Duration.ofMinutes(10), true);

        cache.getOrCompile("app-a", "1", context);
        clock.advance(Duration.ofMinutes(5));
        cache.getOrCompile("app-a", "1", context);
        clock.advance(Duration.ofMinutes(6));
        cache.getOrCompile("app-a", "1", context);

        verify(modelCompiler, times(1)).compile(eq("app-a"), eq("1"), anyList());
    }

    @Test
    void testGetOrCompile_CompilerFailurePropagates() {
        when(modelCompiler.compile(eq("broken"), anyString(), anyList()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalArgumentException("Invalid model file")));
        CompiledModelCache cache = cache(10, null, false);

        assertThrows(IllegalArgumentException.class, () -> cache.getOrCompile("broken", "1", context));
        assertFalse(cache.contains("broken"));
    }

    @Test
    void testGetOrCompile_LeavesNoCompileLocksBehind() {
        // Given
        CompiledModelCache cache = cache(2, null, false);

        // When
        for (int i = 0; i < 20; i++) {
            cache.getOrCompile("app-" + i, "1", context);
        }
        when(modelCompiler.compile(eq("broken"), anyString(), anyList()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("syntax error")));
        assertThrows(IllegalStateException.class, () -> cache.getOrCompile("broken", "1", context));

        // Then
        assertEquals(2, cache.size());
        assertEquals(0, cache.pendingCompilations());
    }

    @Test
    void testInvalidate() {
        CompiledModelCache cache = cache(10, null, false);
        cache.getOrCompile("app-a", "1", context);

        cache.invalidate("app-a");
        cache.getOrCompile("app-a", "1", context);

        verify(modelCompiler, times(2)).compile(eq("app-a"), eq("1"), anyList());
    }
}
