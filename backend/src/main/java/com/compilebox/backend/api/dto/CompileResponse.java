package com.compilebox.backend.api.dto;

import com.compilebox.backend.model.CompileOutcome;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response body for POST /api/compile. {@code resultType} is one of
 * {@code success}, {@code compilation_error}, {@code runtime_error},
 * {@code timeout}; null fields are omitted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompileResponse(
        boolean success,
        String  output,
        String  error,
        Long    executionTimeMs,
        String  resultType
) {
    public static CompileResponse from(CompileOutcome outcome) {
        return new CompileResponse(
                outcome.success(),
                outcome.output(),
                outcome.error(),
                outcome.executionTimeMs(),
                outcome.type().wireName()
        );
    }
}
