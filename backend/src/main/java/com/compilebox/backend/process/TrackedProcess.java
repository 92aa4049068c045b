package com.compilebox.backend.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * A child process known to the {@link ProcessRegistry}, together with the
 * task draining its output.
 */
public class TrackedProcess {

    private static final Logger log = LoggerFactory.getLogger(TrackedProcess.class);

    private final String  id;
    private final Process process;
    private final Instant startedAt;

    private volatile Future<String> outputDrain;

    public TrackedProcess(String id, Process process) {
        this(id, process, Instant.now());
    }

    TrackedProcess(String id, Process process, Instant startedAt) {
        this.id        = id;
        this.process   = process;
        this.startedAt = startedAt;
    }

    public String id()         { return id; }
    public Process process()   { return process; }
    public Instant startedAt() { return startedAt; }

    public void attachOutputDrain(Future<String> drain) {
        this.outputDrain = drain;
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public Duration age() {
        return Duration.between(startedAt, Instant.now());
    }

    /**
     * Cancel the output drain, kill the process and its descendants, then
     * wait at most {@code grace} for the OS to reap it.
     *
     * @return true if the process is gone when this method returns
     */
    public boolean destroyForcibly(Duration grace) {
        Future<String> drain = outputDrain;
        if (drain != null) {
            drain.cancel(true);
        }
        if (!process.isAlive()) {
            return true;
        }
        log.warn("Force killing process {} (pid={}, age={}ms)", id, process.pid(), age().toMillis());
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            return process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        }
    }
}
