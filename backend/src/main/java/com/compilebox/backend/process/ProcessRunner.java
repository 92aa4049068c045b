package com.compilebox.backend.process;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one external process to completion under a hard timeout.
 *
 * stdout and stderr are merged and drained by a background task that is
 * started before the exit wait; a child that fills its pipe buffer would
 * otherwise block forever. Every spawned process is registered in the
 * {@link ProcessRegistry} for the duration of the call and is gone from it
 * (and dead) when {@link #run} returns or throws.
 */
@Component
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    /** How long we wait for the OS to reap a force-killed process. */
    static final Duration KILL_GRACE   = Duration.ofSeconds(2);
    /** How long the drain may lag behind process exit before we give up on the output. */
    static final Duration OUTPUT_GRACE = Duration.ofSeconds(5);

    private final ProcessRegistry registry;
    private final MeterRegistry   meterRegistry;
    private final ExecutorService drainPool;

    public ProcessRunner(ProcessRegistry registry, MeterRegistry meterRegistry) {
        this.registry      = registry;
        this.meterRegistry = meterRegistry;
        AtomicInteger threadCount = new AtomicInteger();
        this.drainPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "process-drain-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Spawn {@code command} in {@code workingDir} and wait for it.
     *
     * @param label      short name used in process ids and logs ("compile", "execute", "ast")
     * @param command    executable followed by its arguments
     * @param workingDir directory the process runs in
     * @param timeout    wall-clock budget; the process is killed when it is exceeded
     * @return exit code and output of a process that exited on its own
     * @throws ProcessException SPAWN_FAILED if the OS refused to start the process,
     *                          TIMED_OUT if it had to be killed,
     *                          INTERRUPTED if the calling thread was interrupted
     */
    public ProcessResult run(String label, List<String> command, Path workingDir, Duration timeout) {
        String id = registry.nextId(label);
        TrackedProcess tracked = null;
        long start = System.nanoTime();
        try {
            Process process;
            try {
                log.info("Starting process {}: {} (cwd={})", id, String.join(" ", command), workingDir);
                process = new ProcessBuilder(command)
                        .directory(workingDir.toFile())
                        .redirectErrorStream(true)
                        .start();
            } catch (IOException | RuntimeException e) {
                throw new ProcessException(ProcessException.Kind.SPAWN_FAILED,
                        "Failed to start " + (command.isEmpty() ? "<empty command>" : command.get(0))
                        + ": " + e.getMessage(), e);
            }

            tracked = new TrackedProcess(id, process);
            registry.register(tracked);

            Future<String> drain = drainPool.submit(() -> readFully(process.getInputStream()));
            tracked.attachOutputDrain(drain);

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Process {} timed out after {}ms, force killing", id, timeout.toMillis());
                tracked.destroyForcibly(KILL_GRACE);
                meterRegistry.counter("compilebox.process.timeouts", "label", label).increment();
                throw new ProcessException(ProcessException.Kind.TIMED_OUT,
                        label + " timed out after " + timeout.toMillis() + "ms");
            }

            String output = awaitOutput(id, drain);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            log.info("Process {} exited with code {} in {}ms ({} chars of output)",
                    id, process.exitValue(), elapsedMs, output.length());
            return new ProcessResult(process.exitValue(), output, elapsedMs);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProcessException(ProcessException.Kind.INTERRUPTED,
                    "Interrupted while waiting for " + id, e);
        } finally {
            registry.deregister(id);
            if (tracked != null && tracked.isAlive()) {
                tracked.destroyForcibly(KILL_GRACE);
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        drainPool.shutdownNow();
    }

    private String awaitOutput(String id, Future<String> drain) throws InterruptedException {
        try {
            return drain.get(OUTPUT_GRACE.toMillis(), TimeUnit.MILLISECONDS).stripTrailing();
        } catch (TimeoutException e) {
            drain.cancel(true);
            log.warn("Output of process {} not available {}ms after exit, returning empty output",
                    id, OUTPUT_GRACE.toMillis());
            return "";
        } catch (ExecutionException e) {
            log.warn("Failed to read output of process {}: {}", id, e.getCause().getMessage());
            return "";
        }
    }

    private static String readFully(InputStream in) throws IOException {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
