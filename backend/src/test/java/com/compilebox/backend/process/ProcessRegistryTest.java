package com.compilebox.backend.process;

import com.compilebox.backend.config.PropertiesFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessRegistryTest {

    SimpleMeterRegistry meterRegistry;
    ProcessRegistry     registry;
    List<Process>       started = new ArrayList<>();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        registry      = new ProcessRegistry(meterRegistry);
    }

    @AfterEach
    void tearDown() {
        started.forEach(Process::destroyForcibly);
    }

    // ------------------------------------------------------------------
    // sweep()
    // ------------------------------------------------------------------

    @Test
    void sweep_exitedProcess_isRemoved() throws Exception {
        Process done = start("true");
        done.waitFor(5, TimeUnit.SECONDS);
        registry.register(new TrackedProcess("compile-1", done));

        int removed = registry.sweep(Duration.ofMinutes(5));

        assertThat(removed).isEqualTo(1);
        assertThat(registry.contains("compile-1")).isFalse();
    }

    @Test
    void sweep_defaultAge_killsLiveProcessItCannotConfirmFinished() throws Exception {
        Process sleeper = start("sleep", "30");
        registry.register(new TrackedProcess("compile-1", sleeper, Instant.now().minusSeconds(60)));

        int removed = registry.sweep(PropertiesFixtures.forRoot(Path.of("unused")).staleProcessAge());

        assertThat(removed).isEqualTo(1);
        assertThat(registry.contains("compile-1")).isFalse();
        assertThat(sleeper.waitFor(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void sweep_youngLiveProcessBelowConfiguredAge_isKept() throws Exception {
        registry.register(new TrackedProcess("compile-1", start("sleep", "30")));

        int removed = registry.sweep(Duration.ofMinutes(5));

        assertThat(removed).isZero();
        assertThat(registry.contains("compile-1")).isTrue();
    }

    @Test
    void sweep_staleLiveProcess_isKilledAndRemoved() throws Exception {
        Process sleeper = start("sleep", "30");
        registry.register(new TrackedProcess("ast-1", sleeper, Instant.now().minusSeconds(600)));

        int removed = registry.sweep(Duration.ofMinutes(5));

        assertThat(removed).isEqualTo(1);
        assertThat(registry.size()).isZero();
        assertThat(sleeper.waitFor(5, TimeUnit.SECONDS)).isTrue();
    }

    // ------------------------------------------------------------------
    // killAll()
    // ------------------------------------------------------------------

    @Test
    void killAll_killsEveryProcessAndEmptiesRegistry() throws Exception {
        Process first  = start("sleep", "30");
        Process second = start("sleep", "30");
        registry.register(new TrackedProcess("compile-1", first));
        registry.register(new TrackedProcess("execute-2", second));
        assertThat(meterRegistry.get("compilebox.process.active").gauge().value()).isEqualTo(2.0);

        registry.killAll();

        assertThat(registry.size()).isZero();
        assertThat(first.waitFor(5, TimeUnit.SECONDS)).isTrue();
        assertThat(second.waitFor(5, TimeUnit.SECONDS)).isTrue();
        assertThat(meterRegistry.get("compilebox.process.active").gauge().value()).isZero();
    }

    @Test
    void killAll_emptyRegistry_isNoOp() {
        registry.killAll();

        assertThat(registry.size()).isZero();
    }

    // ------------------------------------------------------------------
    // killOrphans()
    // ------------------------------------------------------------------

    @Test
    @EnabledOnOs(OS.LINUX)
    void killOrphans_matchingCommandLine_isKilled() throws Exception {
        Process orphan = start("sleep", "31.5");

        int killed = registry.killOrphans(Pattern.compile("sleep 31\\.5"));

        assertThat(killed).isGreaterThanOrEqualTo(1);
        assertThat(orphan.waitFor(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void killOrphans_noMatch_killsNothing() {
        assertThat(registry.killOrphans(Pattern.compile("no-such-process-[0-9a-f]{32}"))).isZero();
    }

    @Test
    void deregister_unknownId_isIgnored() {
        registry.deregister("compile-99");

        assertThat(registry.size()).isZero();
    }

    private Process start(String... command) throws IOException {
        Process p = new ProcessBuilder(command).start();
        started.add(p);
        return p;
    }
}
