package com.cube.orchestrator.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-request context handed to every hook.
 *
 * The security context is opaque to the orchestrator: it is only passed
 * through to hooks and never inspected.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequestContext {

    @Builder.Default
    private Map<String, Object> securityContext = new HashMap<>();

    private String requestId;

    public static RequestContext of(Map<String, Object> securityContext) {
        return RequestContext.builder()
                .securityContext(securityContext != null ? new HashMap<>(securityContext) : new HashMap<>())
                .build();
    }
}
