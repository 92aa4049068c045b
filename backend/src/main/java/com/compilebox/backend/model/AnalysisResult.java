package com.compilebox.backend.model;

import java.util.List;

/**
 * Tokens for one analyze request, or the reason the static pass failed.
 */
public record AnalysisResult(
        boolean     success,
        List<Token> tokens,
        String      error,
        long        analysisTimeMs
) {
    public static AnalysisResult success(List<Token> tokens, long analysisTimeMs) {
        return new AnalysisResult(true, List.copyOf(tokens), null, analysisTimeMs);
    }

    public static AnalysisResult error(String error, long analysisTimeMs) {
        return new AnalysisResult(false, List.of(), error, analysisTimeMs);
    }
}
