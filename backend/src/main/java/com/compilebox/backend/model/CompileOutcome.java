package com.compilebox.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Result of one compile-and-run request. Exactly one of the four factory
 * methods describes every request; nothing in the compile flow is thrown
 * past {@code CompileService}.
 *
 * @param output          program output, only for {@link Type#SUCCESS}
 * @param error           compiler/runtime output or a synthesized message otherwise
 * @param executionTimeMs elapsed time, present for success and runtime errors
 */
public record CompileOutcome(
        Type   type,
        String output,
        String error,
        Long   executionTimeMs
) {
    public enum Type {
        SUCCESS("success"),
        COMPILATION_ERROR("compilation_error"),
        RUNTIME_ERROR("runtime_error"),
        TIMEOUT("timeout");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }
    }

    public static CompileOutcome success(String output, long executionTimeMs) {
        return new CompileOutcome(Type.SUCCESS, output, null, executionTimeMs);
    }

    public static CompileOutcome compilationError(String message) {
        return new CompileOutcome(Type.COMPILATION_ERROR, null, message, null);
    }

    public static CompileOutcome runtimeError(String message, long executionTimeMs) {
        return new CompileOutcome(Type.RUNTIME_ERROR, null, message, executionTimeMs);
    }

    public static CompileOutcome timeout(String message) {
        return new CompileOutcome(Type.TIMEOUT, null, message, null);
    }

    public boolean success() {
        return type == Type.SUCCESS;
    }
}
