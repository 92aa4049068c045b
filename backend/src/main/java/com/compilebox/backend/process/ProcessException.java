package com.compilebox.backend.process;

/**
 * Thrown by {@link ProcessRunner} when an external process did not produce
 * an exit code. {@link #getKind()} tells why.
 *
 * Unchecked; callers catch it where they map it to a user-visible outcome.
 */
public class ProcessException extends RuntimeException {

    public enum Kind { SPAWN_FAILED, TIMED_OUT, INTERRUPTED }

    private final Kind kind;

    public ProcessException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProcessException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public boolean isTimeout() { return kind == Kind.TIMED_OUT; }
}
