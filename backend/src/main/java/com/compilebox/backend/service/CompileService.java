package com.compilebox.backend.service;

import com.compilebox.backend.config.CompilerProperties;
import com.compilebox.backend.model.CompileOutcome;
import com.compilebox.backend.model.SourceUnit;
import com.compilebox.backend.process.ProcessException;
import com.compilebox.backend.process.ProcessResult;
import com.compilebox.backend.process.ProcessRunner;
import com.compilebox.backend.workspace.Workspace;
import com.compilebox.backend.workspace.WorkspaceManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Compile-and-run pipeline for one snippet.
 *
 * <pre>
 *   validate → purge temp root → workspace → compile → locate executable → execute → close workspace
 * </pre>
 *
 * Every request ends in exactly one {@link CompileOutcome}; process and I/O
 * failures are classified here, nothing is thrown to the caller. The
 * workspace and any process started for the request are gone by the time
 * this method returns.
 */
@Service
public class CompileService {

    private static final Logger log = LoggerFactory.getLogger(CompileService.class);

    static final String TRUNCATION_MARKER = "\n... (output truncated)";

    private final WorkspaceManager   workspaces;
    private final ProcessRunner      runner;
    private final CompilerProperties properties;
    private final MeterRegistry      meterRegistry;

    public CompileService(WorkspaceManager workspaces, ProcessRunner runner,
                          CompilerProperties properties, MeterRegistry meterRegistry) {
        this.workspaces    = workspaces;
        this.runner        = runner;
        this.properties    = properties;
        this.meterRegistry = meterRegistry;
    }

    public CompileOutcome compileAndExecute(String sourceCode) {
        MDC.put("requestId", UUID.randomUUID().toString().substring(0, 8));
        Timer.Sample sample = Timer.start(meterRegistry);
        String result = "error";
        try {
            CompileOutcome outcome = process(SourceUnit.of(sourceCode));
            result = outcome.type().wireName();
            log.info("Compile request finished: {}", result);
            return outcome;
        } finally {
            sample.stop(meterRegistry.timer("compilebox.compile.duration", "result", result));
            MDC.remove("requestId");
        }
    }

    private CompileOutcome process(SourceUnit source) {
        if (source.isBlank()) {
            return CompileOutcome.compilationError("Source code cannot be empty");
        }
        if (source.length() > properties.maxSourceLength()) {
            return CompileOutcome.compilationError(
                    "Source code exceeds maximum length of " + properties.maxSourceLength() + " characters");
        }

        workspaces.purgeStaleArtifacts();

        try (Workspace workspace = workspaces.create("compile")) {
            String baseName   = "temp_" + workspace.id().substring(0, 8);
            String sourceFile = baseName + ".tri";
            workspace.writeFile(sourceFile, source.text());

            // ---- compile ----
            ProcessResult compiled;
            try {
                compiled = runner.run("compile", compileCommand(sourceFile),
                        workspace.directory(), properties.compilationTimeout());
            } catch (ProcessException e) {
                if (e.isTimeout()) {
                    return CompileOutcome.compilationError(
                            "Compilation timed out after " + properties.compilationTimeout().toMillis() + "ms");
                }
                log.error("Compiler could not be run: {}", e.getMessage());
                return CompileOutcome.compilationError("Failed to run compiler: " + e.getMessage());
            }

            boolean reportedClean = compiled.output().contains(properties.successMarker());
            boolean artifactPresent = ExecutableLocator.findConventional(workspace.directory(), baseName).isPresent();
            if (!compiled.success() || !(reportedClean || artifactPresent)) {
                log.info("Compilation failed with exit code {}", compiled.exitCode());
                return CompileOutcome.compilationError(compilerMessage(compiled));
            }

            Optional<Path> executable = ExecutableLocator.locate(workspace.directory(), baseName, sourceFile);
            if (executable.isEmpty()) {
                log.warn("Compiler reported success but produced no executable in {}", workspace.directory());
                return CompileOutcome.runtimeError(
                        "Compiled executable not found. Compilation may have failed silently.",
                        compiled.elapsedMs());
            }

            // ---- execute ----
            return execute(executable.get(), workspace);

        } catch (IOException e) {
            log.error("Workspace I/O failed: {}", e.getMessage(), e);
            return CompileOutcome.compilationError("Internal server error: " + e.getMessage());
        }
    }

    private CompileOutcome execute(Path executable, Workspace workspace) {
        long start = System.nanoTime();
        ProcessResult executed;
        try {
            executed = runner.run("execute", List.of(executable.toAbsolutePath().toString()),
                    workspace.directory(), properties.executionTimeout());
        } catch (ProcessException e) {
            if (e.isTimeout()) {
                return CompileOutcome.timeout(
                        "Program execution timed out after " + properties.executionTimeout().toMillis() + "ms");
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            return CompileOutcome.runtimeError("Failed to run program: " + e.getMessage(), elapsedMs);
        }

        String output = truncate(executed.output(), properties.maxOutputLength());
        if (executed.success()) {
            return CompileOutcome.success(output, executed.elapsedMs());
        }
        String message = output.isEmpty() ? "Program exited with code " + executed.exitCode() : output;
        return CompileOutcome.runtimeError(message, executed.elapsedMs());
    }

    private List<String> compileCommand(String sourceFile) {
        List<String> command = new ArrayList<>();
        command.add(properties.compilerPath());
        command.addAll(properties.compileFlags());
        command.add(sourceFile);
        return command;
    }

    private static String compilerMessage(ProcessResult compiled) {
        return compiled.output().isEmpty()
                ? "Compilation failed with exit code " + compiled.exitCode()
                : compiled.output();
    }

    static String truncate(String output, int maxLength) {
        if (output.length() <= maxLength) {
            return output;
        }
        int end = maxLength;
        if (end > 0 && Character.isHighSurrogate(output.charAt(end - 1))) {
            end--;
        }
        return output.substring(0, end) + TRUNCATION_MARKER;
    }
}
