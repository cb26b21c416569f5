package com.cube.orchestrator.api;

import com.cube.orchestrator.domain.model.QueryRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Body of {@code POST /load}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoadRequest {

    @Valid
    @NotNull
    private QueryRequest query;

    /** Overrides the configured continue-wait timeout for this call (capped at 90 seconds). */
    private Duration continueWait;
}
