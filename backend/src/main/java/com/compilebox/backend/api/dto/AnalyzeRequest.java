package com.compilebox.backend.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/syntax/analyze.
 *
 * {@code position} is the editor's cursor offset. It is accepted for
 * compatibility with the editor client and not used by the analysis.
 */
public record AnalyzeRequest(
        @NotNull(message = "Source code cannot be null")
        @Size(max = 10_000, message = "Source code cannot exceed 10KB")
        String sourceCode,
        Integer position) {
}
