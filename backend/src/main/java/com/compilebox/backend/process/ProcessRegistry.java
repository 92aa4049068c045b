package com.compilebox.backend.process;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Bookkeeping of every external process currently owned by this service.
 *
 * Request threads register and deregister their own processes; the
 * {@link ProcessSweeper} thread sweeps and, at shutdown, kills whatever is
 * left. The map is the only state shared between those actors, so every
 * mutation goes through {@link ConcurrentHashMap}'s atomic operations.
 */
@Component
public class ProcessRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProcessRegistry.class);

    static final Duration KILL_GRACE = Duration.ofSeconds(2);

    private final Map<String, TrackedProcess> processes = new ConcurrentHashMap<>();
    private final AtomicLong counter = new AtomicLong();

    public ProcessRegistry(MeterRegistry meterRegistry) {
        Gauge.builder("compilebox.process.active", processes, Map::size)
                .description("External processes currently tracked")
                .register(meterRegistry);
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    /** Next process id, e.g. {@code compile-42}. */
    public String nextId(String label) {
        return label + "-" + counter.incrementAndGet();
    }

    public void register(TrackedProcess tracked) {
        processes.put(tracked.id(), tracked);
        log.debug("Registered process {} (pid={}), {} active",
                tracked.id(), tracked.process().pid(), processes.size());
    }

    public void deregister(String id) {
        if (processes.remove(id) != null) {
            log.debug("Deregistered process {}, {} active", id, processes.size());
        }
    }

    public boolean contains(String id) {
        return processes.containsKey(id);
    }

    public int size() {
        return processes.size();
    }

    // ------------------------------------------------------------------
    // Sweep and shutdown
    // ------------------------------------------------------------------

    /**
     * Drop entries whose process has exited and kill entries that are older
     * than {@code staleAfter} and still cannot be confirmed finished by a
     * non-blocking poll.
     *
     * @return number of entries removed
     */
    public int sweep(Duration staleAfter) {
        AtomicInteger removed = new AtomicInteger();
        processes.entrySet().removeIf(entry -> {
            TrackedProcess tracked = entry.getValue();
            if (!tracked.isAlive()) {
                log.debug("Sweep: removing exited process {}", entry.getKey());
                removed.incrementAndGet();
                return true;
            }
            if (tracked.age().compareTo(staleAfter) < 0) {
                return false;
            }
            try {
                if (tracked.process().waitFor(0, TimeUnit.NANOSECONDS)) {
                    removed.incrementAndGet();
                    return true;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.warn("Sweep: killing stuck process {} after {}ms", entry.getKey(), tracked.age().toMillis());
            tracked.destroyForcibly(KILL_GRACE);
            removed.incrementAndGet();
            return true;
        });
        log.info("Process sweep removed {} entries, {} active", removed.get(), processes.size());
        return removed.get();
    }

    /**
     * Kill every tracked process in parallel and clear the registry.
     * A failure to kill one process does not stop the others.
     */
    public void killAll() {
        log.info("Killing {} active processes", processes.size());
        processes.values().parallelStream().forEach(tracked -> {
            try {
                tracked.destroyForcibly(KILL_GRACE);
            } catch (RuntimeException e) {
                log.warn("Failed to kill process {}: {}", tracked.id(), e.getMessage());
            }
        });
        processes.clear();
    }

    /**
     * Kill processes left behind by a previous instance of this service,
     * recognised by their command line. Best-effort: anything that goes
     * wrong is logged and skipped.
     *
     * @return number of processes a kill was issued for
     */
    public int killOrphans(Pattern commandLinePattern) {
        long self = ProcessHandle.current().pid();
        AtomicInteger killed = new AtomicInteger();
        try {
            ProcessHandle.allProcesses()
                    .filter(handle -> handle.pid() != self)
                    .filter(handle -> handle.info().commandLine()
                            .map(cmd -> commandLinePattern.matcher(cmd).find())
                            .orElse(false))
                    .forEach(handle -> {
                        log.warn("Killing orphaned compiler process pid={} ({})",
                                handle.pid(), handle.info().commandLine().orElse("?"));
                        try {
                            if (handle.destroyForcibly()) {
                                killed.incrementAndGet();
                            }
                        } catch (RuntimeException e) {
                            log.warn("Failed to kill orphan pid={}: {}", handle.pid(), e.getMessage());
                        }
                    });
        } catch (RuntimeException e) {
            log.warn("Orphan process scan failed: {}", e.getMessage());
        }
        return killed.get();
    }
}
