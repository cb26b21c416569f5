package com.cube.orchestrator.domain.hook;

import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * Turns the Authorization header of an API request into a security context.
 * Completes exceptionally with {@code AuthDeniedException} to reject the request.
 */
@FunctionalInterface
public interface CheckAuth {

    CompletionStage<Map<String, Object>> authenticate(String authorization);
}
