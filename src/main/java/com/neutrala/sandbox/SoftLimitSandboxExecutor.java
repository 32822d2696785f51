package com.neutrala.sandbox;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs the program directly, relying only on the wall-clock timer and the output cap.
 * Available on every operating system.
 */
public class SoftLimitSandboxExecutor implements SandboxExecutor {

    public static final String NAME = "soft";

    private final ProcessSupervisor supervisor;

    SoftLimitSandboxExecutor(ProcessSupervisor supervisor) {
        this.supervisor = supervisor;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExecutionResult execute(Path executable, Path traceOutput, Path debugLog, ExecutionOptions options) {
        List<String> command = List.of(executable.toAbsolutePath().toString());
        return supervisor.run(NAME, command, executable, traceOutput, debugLog, options);
    }
}
