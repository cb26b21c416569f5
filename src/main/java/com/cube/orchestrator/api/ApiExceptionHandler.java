package com.cube.orchestrator.api;

import com.cube.orchestrator.domain.exception.ContinueWaitException;
import com.cube.orchestrator.domain.exception.ErrorKind;
import com.cube.orchestrator.domain.exception.OrchestratorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.DateTimeException;

/**
 * Maps orchestrator failures to HTTP responses.
 *
 * - auth denied: 403
 * - policy and configuration rejections (capacity, rollup-only, driver config, failed query): 400
 * - retryable conditions (timeouts, cancellation, partitions not ready): 503
 * - continue wait: 200 with {"error": "Continue wait"}
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ContinueWaitException.class)
    public ResponseEntity<ErrorResponse> handleContinueWait(ContinueWaitException e) {
        return ResponseEntity.ok(ErrorResponse.continueWait(e.getQueryKey()));
    }

    @ExceptionHandler(OrchestratorException.class)
    public ResponseEntity<ErrorResponse> handleOrchestratorException(OrchestratorException e) {
        HttpStatus status = statusOf(e.getKind());
        if (status.is5xxServerError()) {
            log.warn("Request failed with retryable error {}: {}", e.getKind(), e.getMessage());
        } else {
            log.info("Request rejected with {}: {}", e.getKind(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.getMessage(), e.getKind(), e.isRetryable(), null));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .orElse("Invalid request");
        return ResponseEntity.badRequest().body(new ErrorResponse(message, null, false, null));
    }

    @ExceptionHandler({IllegalArgumentException.class, DateTimeException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage(), null, false, null));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(RuntimeException e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Internal error", null, false, null));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        switch (kind) {
            case AUTH_DENIED:
                return HttpStatus.FORBIDDEN;
            case CONTINUE_WAIT:
                return HttpStatus.OK;
            default:
                return kind.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_REQUEST;
        }
    }
}
