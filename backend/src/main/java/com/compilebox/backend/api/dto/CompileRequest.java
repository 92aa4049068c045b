package com.compilebox.backend.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/compile.
 */
public record CompileRequest(
        @NotBlank(message = "Source code cannot be empty")
        @Size(max = 10_000, message = "Source code cannot exceed 10000 characters")
        String sourceCode) {

    /** Source with surrounding whitespace and NUL bytes removed. */
    public String sanitizedSourceCode() {
        return sourceCode == null ? "" : sourceCode.replace("\0", "").trim();
    }
}
