package com.cube.orchestrator.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Expression whose value changes when the underlying data changes.
 *
 * Either an SQL check query (first column of the first row is the value)
 * or a time bucket of length {@code every}, aligned in {@code timezone}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefreshKey {

    private String sql;

    @Builder.Default
    private List<Object> params = new ArrayList<>();

    private String dataSource;

    private Duration every;

    private String timezone;

    @JsonIgnore
    public boolean isTimeBased() {
        return every != null;
    }

    public static RefreshKey sql(String sql, Object... params) {
        return RefreshKey.builder().sql(sql).params(new ArrayList<>(List.of(params))).build();
    }

    public static RefreshKey every(Duration every) {
        return RefreshKey.builder().every(every).build();
    }
}
