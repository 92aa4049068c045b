package com.compilebox.backend.api.dto;

import com.compilebox.backend.model.AnalysisResult;
import com.compilebox.backend.model.Token;

import java.util.List;

/**
 * Response body for POST /api/syntax/analyze.
 */
public record AnalyzeResponse(
        boolean     success,
        List<Token> tokens,
        String      error,
        long        analysisTimeMs
) {
    public static AnalyzeResponse from(AnalysisResult result) {
        return new AnalyzeResponse(result.success(), result.tokens(), result.error(), result.analysisTimeMs());
    }

    public static AnalyzeResponse error(String error) {
        return new AnalyzeResponse(false, List.of(), error, 0);
    }
}
