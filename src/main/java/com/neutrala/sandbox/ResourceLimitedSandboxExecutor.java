package com.neutrala.sandbox;

import com.neutrala.platform.OsFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wraps the program in {@code prlimit} so the kernel enforces address-space and CPU-time
 * ceilings, then applies the same timer and output cap as {@link SoftLimitSandboxExecutor}.
 * Linux only. With no ceiling configured the program runs unwrapped.
 */
public class ResourceLimitedSandboxExecutor implements SandboxExecutor {

    private static final Logger log = LoggerFactory.getLogger(ResourceLimitedSandboxExecutor.class);

    public static final String NAME = "prlimit";

    private final ProcessSupervisor supervisor;
    private final Path prlimit;

    ResourceLimitedSandboxExecutor(ProcessSupervisor supervisor, Path prlimit) {
        this.supervisor = supervisor;
        this.prlimit = prlimit;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExecutionResult execute(Path executable, Path traceOutput, Path debugLog, ExecutionOptions options) {
        List<String> command = wrapCommand(executable, options);
        if (command.size() == 1) {
            log.debug("No memory or CPU ceiling configured, running {} without prlimit", executable.getFileName());
        }
        return supervisor.run(NAME, command, executable, traceOutput, debugLog, options);
    }

    List<String> wrapCommand(Path executable, ExecutionOptions options) {
        String target = executable.toAbsolutePath().toString();
        if (!options.hasHardLimits()) {
            return List.of(target);
        }
        var command = new ArrayList<String>();
        command.add(prlimit.toString());
        if (options.memoryBytes() > 0) {
            command.add("--as=" + options.memoryBytes());
        }
        if (options.cpuSeconds() > 0) {
            command.add("--cpu=" + options.cpuSeconds());
        }
        command.add("--");
        command.add(target);
        return command;
    }

    /**
     * Locates an executable {@code prlimit} on the given PATH. Only Linux ships it.
     */
    static Optional<Path> locatePrlimit(OsFamily osFamily, Map<String, String> env) {
        if (osFamily != OsFamily.LINUX) {
            return Optional.empty();
        }
        String path = env.getOrDefault("PATH", "");
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) continue;
            Path candidate = Path.of(dir, "prlimit");
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
