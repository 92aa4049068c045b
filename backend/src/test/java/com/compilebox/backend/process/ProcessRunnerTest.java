package com.compilebox.backend.process;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs real processes, so only on POSIX systems with a shell.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessRunnerTest {

    @TempDir Path workDir;

    SimpleMeterRegistry meterRegistry;
    ProcessRegistry     registry;
    ProcessRunner       runner;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        registry      = new ProcessRegistry(meterRegistry);
        runner        = new ProcessRunner(registry, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        runner.shutdown();
    }

    // ------------------------------------------------------------------
    // Normal exit
    // ------------------------------------------------------------------

    @Test
    void run_echo_returnsOutputAndZeroExit() {
        ProcessResult result = runner.run("test", List.of("echo", "привет"), workDir, Duration.ofSeconds(5));

        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEqualTo("привет");
        assertThat(registry.size()).isZero();
    }

    @Test
    void run_nonZeroExit_mergesStderrIntoOutput() {
        ProcessResult result = runner.run("test",
                List.of("sh", "-c", "echo out; echo err 1>&2; exit 3"), workDir, Duration.ofSeconds(5));

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.output()).contains("out").contains("err");
    }

    @Test
    void run_outputLargerThanPipeBuffer_doesNotDeadlock() {
        ProcessResult result = runner.run("test",
                List.of("sh", "-c", "head -c 300000 /dev/zero | tr '\\0' x"), workDir, Duration.ofSeconds(10));

        assertThat(result.success()).isTrue();
        assertThat(result.output()).hasSize(300_000);
    }

    @Test
    void run_usesWorkingDirectory() throws Exception {
        ProcessResult result = runner.run("test", List.of("pwd"), workDir, Duration.ofSeconds(5));

        assertThat(Path.of(result.output()).toRealPath()).isEqualTo(workDir.toRealPath());
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    @Test
    void run_exceedsTimeout_killedWithinGraceAndRegistryEmpty() {
        long start = System.nanoTime();

        assertThatThrownBy(() -> runner.run("sleeper", List.of("sleep", "10"), workDir, Duration.ofMillis(300)))
                .isInstanceOfSatisfying(ProcessException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ProcessException.Kind.TIMED_OUT);
                    assertThat(e.getMessage()).contains("300ms");
                });

        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        assertThat(elapsedMs).isLessThan(300 + ProcessRunner.KILL_GRACE.toMillis() + 1_500);
        assertThat(registry.size()).isZero();
        assertThat(meterRegistry.counter("compilebox.process.timeouts", "label", "sleeper").count())
                .isEqualTo(1.0);
    }

    @Test
    void run_missingExecutable_throwsSpawnFailed() {
        assertThatThrownBy(() -> runner.run("test",
                List.of(workDir.resolve("no-such-binary").toString()), workDir, Duration.ofSeconds(5)))
                .isInstanceOfSatisfying(ProcessException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ProcessException.Kind.SPAWN_FAILED));
        assertThat(registry.size()).isZero();
    }

    @Test
    void run_assignsIncreasingIdsPerCall() {
        runner.run("test", List.of("true"), workDir, Duration.ofSeconds(5));
        runner.run("test", List.of("true"), workDir, Duration.ofSeconds(5));

        assertThat(registry.nextId("test")).isEqualTo("test-3");
    }
}
