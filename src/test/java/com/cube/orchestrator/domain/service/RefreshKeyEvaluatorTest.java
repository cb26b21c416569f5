package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.domain.model.QueueOptions;
import com.cube.orchestrator.domain.model.RefreshKey;
import com.cube.orchestrator.support.InMemoryQueryDriver;
import com.cube.orchestrator.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class RefreshKeyEvaluatorTest {

    private QueryQueue queue;
    private InMemoryQueryDriver driver;
    private final List<String> requestedDataSources = new ArrayList<>();
    private RefreshKeyEvaluator evaluator;

    @BeforeEach
    void setUp() {
        queue = new QueryQueue("refresh-keys", new QueueOptions(), Executors.newCachedThreadPool(),
                MutableClock.at("2024-03-01T10:00:00Z"), new SimpleMeterRegistry());
        driver = new InMemoryQueryDriver();
        evaluator = new RefreshKeyEvaluator(queue, dataSource -> {
            requestedDataSources.add(dataSource);
            return driver;
        }, Duration.ofMillis(20));
    }

    @AfterEach
    void tearDown() {
        queue.shutdown();
    }

    @Test
    void testApply_ReturnsFirstColumnOfFirstRow() {
        driver.answering("SELECT max(updated_at), count(*) FROM orders", params -> {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("max", "2024-02-29");
            row.put("count", 17);
            return List.of(row);
        });

        String value = evaluator.apply(RefreshKeyEvaluator.withDefaultDataSource(
                RefreshKey.sql("SELECT max(updated_at), count(*) FROM orders"), "default"));

        assertEquals("2024-02-29", value);
        assertEquals(List.of("default"), requestedDataSources);
    }

    @Test
    void testApply_EmptyResultIsEmptyString() {
        assertEquals("", evaluator.apply(RefreshKey.sql("SELECT max(id) FROM empty_table")));
    }

    @Test
    void testWithDefaultDataSource_KeepsExplicitDataSource() {
        RefreshKey explicit = RefreshKey.builder().sql("SELECT 1").dataSource("replica").build();

        assertSame(explicit, RefreshKeyEvaluator.withDefaultDataSource(explicit, "default"));
        assertEquals("default", RefreshKeyEvaluator.withDefaultDataSource(RefreshKey.sql("SELECT 1"), "default").getDataSource());
    }
}
