package com.neutrala.sandbox;

import java.nio.file.Path;

/**
 * Runs an instrumented executable under resource limits.
 * Implementations: {@link SoftLimitSandboxExecutor} (timer and byte cap, every OS),
 * {@link ResourceLimitedSandboxExecutor} (adds OS-enforced ceilings where available).
 * One of them is chosen at startup by {@link SandboxConfig}.
 */
public interface SandboxExecutor {

    /**
     * Short name reported in {@link ExecutionResult#executor()} and health checks.
     */
    String name();

    /**
     * Blocks until the program exits, times out, or is killed for exceeding the output cap.
     *
     * @param executable  program to run, working directory is its parent
     * @param traceOutput path handed to the program as {@code TRACE_OUTPUT}
     * @param debugLog    where crash diagnostics are written if the program fails
     * @throws SandboxException if the process cannot be spawned
     */
    ExecutionResult execute(Path executable, Path traceOutput, Path debugLog, ExecutionOptions options);
}
