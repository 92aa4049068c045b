package com.compilebox.backend.process;

import com.compilebox.backend.config.CompilerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Background reconciliation of the {@link ProcessRegistry}.
 *
 * Started and stopped with the application context:
 * <ul>
 *   <li>{@link #start()} kills compiler processes orphaned by a previous,
 *       crashed instance and schedules {@link ProcessRegistry#sweep} every
 *       {@code sweep-interval};</li>
 *   <li>{@link #stop()} cancels the schedule and kills every process that is
 *       still tracked.</li>
 * </ul>
 * The sweeper owns its single scheduler thread; nothing else runs on it.
 */
@Component
public class ProcessSweeper implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ProcessSweeper.class);

    /** Lower than the web server's graceful-shutdown and start/stop phases; stopped after both. */
    static final int PHASE = SmartLifecycle.DEFAULT_PHASE - 4096;

    private final ProcessRegistry    registry;
    private final CompilerProperties properties;

    private ScheduledExecutorService scheduler;
    private volatile boolean running;

    public ProcessSweeper(ProcessRegistry registry, CompilerProperties properties) {
        this.registry   = registry;
        this.properties = properties;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        reapOrphans();

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "process-sweeper");
            t.setDaemon(true);
            return t;
        });
        long periodMs = properties.sweepInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::sweepOnce, periodMs, periodMs, TimeUnit.MILLISECONDS);
        running = true;
        log.info("Process sweeper started (interval={}ms, staleAfter={}ms)",
                periodMs, properties.staleProcessAge().toMillis());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        registry.killAll();
        log.info("Process sweeper stopped");
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void reapOrphans() {
        String pattern = properties.orphanPattern();
        if (pattern == null || pattern.isBlank()) {
            return;
        }
        try {
            int killed = registry.killOrphans(Pattern.compile(pattern));
            if (killed > 0) {
                log.warn("Killed {} orphaned compiler processes matching '{}'", killed, pattern);
            }
        } catch (RuntimeException e) {
            log.warn("Orphan scan for '{}' failed: {}", pattern, e.getMessage());
        }
    }

    // An exception escaping a scheduleAtFixedRate task cancels all later runs.
    private void sweepOnce() {
        try {
            registry.sweep(properties.staleProcessAge());
        } catch (RuntimeException e) {
            log.error("Process sweep failed: {}", e.getMessage(), e);
        }
    }
}
