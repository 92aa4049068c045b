package com.compilebox.backend.process;

/**
 * Exit status and merged stdout/stderr of a process that exited on its own.
 *
 * @param exitCode  OS exit code
 * @param output    Combined output decoded as UTF-8, trailing whitespace stripped;
 *                  empty when the output could not be collected in time
 * @param elapsedMs Wall-clock time from spawn to exit
 */
public record ProcessResult(int exitCode, String output, long elapsedMs) {

    public boolean success() {
        return exitCode == 0;
    }
}
