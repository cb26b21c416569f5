package com.cube.orchestrator.domain.service;

import com.cube.orchestrator.domain.model.RefreshKey;
import com.cube.orchestrator.infrastructure.driver.QueryDriver;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Runs SQL refresh keys through a query queue, ahead of regular queries.
 *
 * The value of a refresh key is the first column of its first row, or an
 * empty string when the check query returns nothing.
 */
public class RefreshKeyEvaluator implements Function<RefreshKey, String> {

    static final int REFRESH_KEY_PRIORITY = 1000;

    private final QueryQueue queue;
    private final Function<String, QueryDriver> drivers;
    private final Duration pollInterval;

    public RefreshKeyEvaluator(QueryQueue queue, Function<String, QueryDriver> drivers, Duration pollInterval) {
        this.queue = queue;
        this.drivers = drivers;
        this.pollInterval = pollInterval;
    }

    @Override
    public String apply(RefreshKey refreshKey) {
        String queryKey = "refresh-key:" + RefreshKeyCache.cacheKey(refreshKey);
        Object value = queue.executeInQueue(queryKey, REFRESH_KEY_PRIORITY,
                context -> firstValue(drivers.apply(refreshKey.getDataSource())
                        .query(refreshKey.getSql(), refreshKey.getParams())),
                true, pollInterval);
        return (String) value;
    }

    /**
     * Copy of the key bound to {@code dataSource} unless it names one itself.
     */
    public static RefreshKey withDefaultDataSource(RefreshKey refreshKey, String dataSource) {
        if (refreshKey.getDataSource() != null || refreshKey.isTimeBased()) {
            return refreshKey;
        }
        return RefreshKey.builder()
                .sql(refreshKey.getSql())
                .params(refreshKey.getParams())
                .dataSource(dataSource)
                .timezone(refreshKey.getTimezone())
                .build();
    }

    static String firstValue(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty() || rows.get(0).isEmpty()) {
            return "";
        }
        return String.valueOf(rows.get(0).values().iterator().next());
    }
}
