package com.compilebox.backend.api;

import com.compilebox.backend.api.dto.CompileRequest;
import com.compilebox.backend.api.dto.CompileResponse;
import com.compilebox.backend.model.CompileOutcome;
import com.compilebox.backend.service.CompileService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.stream.Collectors;

/**
 * REST API for compile-and-run.
 *
 * POST /api/compile : compile a snippet and run it
 * GET  /api/health  : liveness string
 */
@RestController
@RequestMapping("/api")
public class CompileController {

    private static final Logger log = LoggerFactory.getLogger(CompileController.class);

    private final CompileService compileService;

    public CompileController(CompileService compileService) {
        this.compileService = compileService;
    }

    /**
     * Compile and run a snippet. Compiler and program failures are reported
     * in the body with status 200; only an unexpected exception yields 500.
     *
     * Example:
     *   curl -X POST http://localhost:8080/api/compile \
     *     -H "Content-Type: application/json" \
     *     -d '{"sourceCode":"вход { вывод.ф(\"Привет\\n\") }"}'
     */
    @PostMapping("/compile")
    public ResponseEntity<CompileResponse> compile(@Valid @RequestBody CompileRequest req) {
        log.info("Received compile request ({} chars)", req.sourceCode().length());
        try {
            CompileOutcome outcome = compileService.compileAndExecute(req.sanitizedSourceCode());
            return ResponseEntity.ok(CompileResponse.from(outcome));
        } catch (RuntimeException e) {
            log.error("Unexpected error during compilation: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(CompileResponse.from(
                    CompileOutcome.compilationError("Internal server error: " + e.getMessage())));
        }
    }

    @GetMapping("/health")
    public String health() {
        return "Compilebox backend is healthy";
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<CompileResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " - " + error.getDefaultMessage())
                .collect(Collectors.joining("; ", "Validation error: ", ""));
        log.warn("{}", message);
        return ResponseEntity.badRequest().body(CompileResponse.from(CompileOutcome.compilationError(message)));
    }
}
