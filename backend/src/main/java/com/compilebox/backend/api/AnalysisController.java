package com.compilebox.backend.api;

import com.compilebox.backend.api.dto.AnalyzeRequest;
import com.compilebox.backend.api.dto.AnalyzeResponse;
import com.compilebox.backend.service.AnalysisService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.stream.Collectors;

/**
 * REST API for editor highlighting.
 *
 * POST /api/syntax/analyze : classified tokens for a snippet
 * GET  /api/syntax/health  : liveness string
 */
@RestController
@RequestMapping("/api/syntax")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisService analysisService;

    public AnalysisController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/analyze")
    public ResponseEntity<AnalyzeResponse> analyze(@Valid @RequestBody AnalyzeRequest req) {
        log.debug("Received analyze request ({} chars, position={})", req.sourceCode().length(), req.position());
        try {
            return ResponseEntity.ok(AnalyzeResponse.from(analysisService.analyze(req.sourceCode())));
        } catch (RuntimeException e) {
            log.error("Unexpected error during analysis: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                    .body(AnalyzeResponse.error("Internal server error: " + e.getMessage()));
        }
    }

    @GetMapping("/health")
    public String health() {
        return "Syntax analysis service is running";
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<AnalyzeResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " - " + error.getDefaultMessage())
                .collect(Collectors.joining("; ", "Validation error: ", ""));
        log.warn("{}", message);
        return ResponseEntity.badRequest().body(AnalyzeResponse.error(message));
    }
}
