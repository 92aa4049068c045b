package com.compilebox.backend.service;

import com.compilebox.backend.analysis.LexicalAnalyzer;
import com.compilebox.backend.analysis.SemanticEnhancer;
import com.compilebox.backend.model.AnalysisResult;
import com.compilebox.backend.model.SourceUnit;
import com.compilebox.backend.model.Token;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Analyze flow: the static pass must succeed, the AST-based pass only
 * improves on it.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final LexicalAnalyzer  lexer;
    private final SemanticEnhancer enhancer;
    private final MeterRegistry    meterRegistry;

    public AnalysisService(LexicalAnalyzer lexer, SemanticEnhancer enhancer, MeterRegistry meterRegistry) {
        this.lexer         = lexer;
        this.enhancer      = enhancer;
        this.meterRegistry = meterRegistry;
    }

    public AnalysisResult analyze(String sourceCode) {
        MDC.put("requestId", UUID.randomUUID().toString().substring(0, 8));
        Timer.Sample sample = Timer.start(meterRegistry);
        long start = System.nanoTime();
        String result = "success";
        try {
            SourceUnit source = SourceUnit.of(sourceCode);

            List<Token> staticTokens;
            try {
                staticTokens = lexer.tokenize(source.text());
            } catch (RuntimeException e) {
                result = "error";
                log.error("Static analysis failed: {}", e.getMessage(), e);
                return AnalysisResult.error("Syntax analysis failed: " + e.getMessage(), elapsedMs(start));
            }

            List<Token> tokens = enhancer.enhance(source, staticTokens);
            log.info("Analyzed {} chars into {} tokens", source.length(), tokens.size());
            return AnalysisResult.success(tokens, elapsedMs(start));
        } finally {
            sample.stop(meterRegistry.timer("compilebox.analysis.duration", "result", result));
            MDC.remove("requestId");
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
