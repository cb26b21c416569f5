package com.cube.orchestrator.domain.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A query already translated to data-source SQL, with its cache and rollup metadata.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    public static final String DEFAULT_DATA_SOURCE = "default";

    @NotBlank
    private String sql;

    @Builder.Default
    private List<Object> params = new ArrayList<>();

    @Builder.Default
    private String dataSource = DEFAULT_DATA_SOURCE;

    @Builder.Default
    private List<RefreshKey> refreshKeys = new ArrayList<>();

    @Builder.Default
    private List<PreAggregationUsage> preAggregations = new ArrayList<>();

    private String timezone;

    private boolean renewQuery;

    private Integer priority;

    public String getDataSource() {
        return dataSource != null ? dataSource : DEFAULT_DATA_SOURCE;
    }

    public String getTimezone() {
        return timezone != null ? timezone : "UTC";
    }

    public int getPriority() {
        return priority != null ? priority : 0;
    }
}
