package com.neutrala.sandbox;

/**
 * Outcome of running an instrumented program.
 *
 * @param stdout    captured standard output, at most the configured cap
 * @param stderr    captured standard error, at most the configured cap
 * @param exitCode  exit status, or {@code null} when the process died from a signal
 * @param signal    terminating signal name such as {@code SIGSEGV}, or {@code null}
 * @param timedOut  the wall-clock timer fired and the process was killed
 * @param truncated output exceeded the cap and the process was killed
 * @param elapsedMs wall-clock time from spawn to exit
 * @param executor  name of the executor that ran the program
 */
public record ExecutionResult(
        String stdout,
        String stderr,
        Integer exitCode,
        String signal,
        boolean timedOut,
        boolean truncated,
        long elapsedMs,
        String executor
) {

    /**
     * True when the process exited with status 0 on its own.
     */
    public boolean exitedCleanly() {
        return exitCode != null && exitCode == 0 && !timedOut && !truncated;
    }

    /**
     * The trace may be missing its tail because the run was cut short.
     */
    public boolean haltedEarly() {
        return timedOut || truncated;
    }
}
