package com.compilebox.backend.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Settings for the external compiler and the sandbox around it
 * ({@code compilebox.compiler.*} in application.yml).
 *
 * @param compilerPath      Absolute path of the compiler/runtime executable.
 * @param tempDirectory     Root under which every request gets its own workspace.
 * @param compilationTimeout Budget for a compile or AST-dump invocation.
 * @param executionTimeout  Budget for running the compiled program.
 * @param maxSourceLength   Longest accepted snippet, in characters.
 * @param maxOutputLength   Program output is cut to this many characters.
 * @param successMarker     Text the compiler prints when a build has no errors.
 * @param compileFlags      Extra flags placed before the source file on a plain compile.
 * @param astFlags          Flags that switch the compiler into AST-dump mode.
 * @param orphanPattern     Regex matched against command lines of leftover compiler
 *                          processes killed at start-up.
 * @param sweepInterval     Period of the background registry sweep.
 * @param staleProcessAge   Minimum age of a live process before the sweep may kill it.
 *                          Defaults to zero: every live entry a non-blocking poll
 *                          cannot confirm finished is killed.
 */
@ConfigurationProperties(prefix = "compilebox.compiler")
@Validated
public record CompilerProperties(
        @NotBlank @DefaultValue("/app/compiler/trivil")  String       compilerPath,
        @NotBlank @DefaultValue("/app/temp")             String       tempDirectory,
        @NotNull  @DefaultValue("300s")                  Duration     compilationTimeout,
        @NotNull  @DefaultValue("10s")                   Duration     executionTimeout,
        @Positive @DefaultValue("10000")                 int          maxSourceLength,
        @Positive @DefaultValue("50000")                 int          maxOutputLength,
        @NotBlank @DefaultValue("Без ошибок")            String       successMarker,
        @DefaultValue                                     List<String> compileFlags,
        @DefaultValue({"-ast", "2"})                     List<String> astFlags,
        @DefaultValue("trivil.*-ast")                    String       orphanPattern,
        @NotNull  @DefaultValue("120s")                  Duration     sweepInterval,
        Duration staleProcessAge) {

    public CompilerProperties {
        compileFlags = compileFlags == null ? List.of() : List.copyOf(compileFlags);
        astFlags     = astFlags == null ? List.of() : List.copyOf(astFlags);
        if (staleProcessAge == null) {
            staleProcessAge = Duration.ZERO;
        }
    }

    public Path tempRoot() {
        return Path.of(tempDirectory).toAbsolutePath().normalize();
    }
}
