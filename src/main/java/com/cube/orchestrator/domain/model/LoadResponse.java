package com.cube.orchestrator.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadResponse {

    private String queryKey;

    private Object data;

    private List<String> usedPreAggregations;

    private String appId;

    private String orchestratorId;
}
