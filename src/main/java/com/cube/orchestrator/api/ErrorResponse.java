package com.cube.orchestrator.api;

import com.cube.orchestrator.domain.exception.ErrorKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String error;

    private ErrorKind kind;

    private Boolean retryable;

    /** Handle to poll, when the query keeps running. */
    private String queryKey;

    public static ErrorResponse continueWait(String queryKey) {
        return new ErrorResponse("Continue wait", null, null, queryKey);
    }
}
