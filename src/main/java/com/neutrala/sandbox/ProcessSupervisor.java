package com.neutrala.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.neutrala.platform.OsFamily;
import com.neutrala.platform.PlatformAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Spawns one child process and enforces the soft limits on it: a wall-clock timer and a
 * per-stream output cap. Whichever fires first kills the process; killing is idempotent.
 * Both executors run through here, so the soft-limit behaviour is identical with or
 * without OS-enforced ceilings.
 */
class ProcessSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);

    private static final int DRAIN_BUFFER_BYTES = 8192;
    private static final long DRAIN_JOIN_MS = 2000;

    private static final Map<Integer, String> SIGNAL_NAMES = Map.of(
            1, "SIGHUP",
            2, "SIGINT",
            4, "SIGILL",
            6, "SIGABRT",
            8, "SIGFPE",
            9, "SIGKILL",
            11, "SIGSEGV",
            13, "SIGPIPE",
            15, "SIGTERM",
            24, "SIGXCPU"
    );

    private final PlatformAdapter platformAdapter;
    private final Supplier<List<Path>> libraryDirs;
    private final Map<String, String> baseEnvironment;
    private final ObjectMapper objectMapper;

    ProcessSupervisor(PlatformAdapter platformAdapter,
                      Supplier<List<Path>> libraryDirs,
                      Map<String, String> baseEnvironment,
                      ObjectMapper objectMapper) {
        this.platformAdapter = platformAdapter;
        this.libraryDirs = libraryDirs;
        this.baseEnvironment = baseEnvironment;
        this.objectMapper = objectMapper;
    }

    ExecutionResult run(String executorName, List<String> command, Path executable,
                        Path traceOutput, Path debugLog, ExecutionOptions options) {
        Map<String, String> env = new LinkedHashMap<>(
                platformAdapter.buildExecutionEnvironment(baseEnvironment, libraryDirs.get()));
        env.put("TRACE_OUTPUT", traceOutput.toAbsolutePath().toString());

        Path workDir = executable.toAbsolutePath().getParent();
        ProcessBuilder pb = new ProcessBuilder(command)
                .redirectInput(ProcessBuilder.Redirect.PIPE);
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }
        pb.environment().clear();
        pb.environment().putAll(env);

        log.info("Executing {} via {} (timeout {} ms, output cap {} bytes)",
                executable.getFileName(), executorName, options.timeMs(), options.maxOutputBytes());
        log.debug("Command: {}", String.join(" ", command));

        long started = System.nanoTime();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new SandboxException("Failed to execute " + executable + ": " + e.getMessage(), e);
        }
        closeStdin(process);

        var killed = new AtomicBoolean(false);
        var truncated = new AtomicBoolean(false);
        Runnable terminate = () -> {
            if (killed.compareAndSet(false, true) && process.isAlive()) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        };

        var stdout = new CappedOutputSink(options.maxOutputBytes());
        var stderr = new CappedOutputSink(options.maxOutputBytes());
        Thread outDrain = drain("stdout", process.getInputStream(), stdout, truncated, terminate);
        Thread errDrain = drain("stderr", process.getErrorStream(), stderr, truncated, terminate);

        boolean timedOut = false;
        try {
            if (!process.waitFor(options.timeMs(), TimeUnit.MILLISECONDS)) {
                // the cap may have fired in the same instant; only count the timer if it got there first
                timedOut = !killed.get();
                terminate.run();
                process.waitFor();
            }
            outDrain.join(DRAIN_JOIN_MS);
            errDrain.join(DRAIN_JOIN_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminate.run();
            throw new SandboxException("Interrupted while waiting for " + executable, e);
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        int status = process.exitValue();
        Integer exitCode = status;
        String signal = null;
        if (platformAdapter.osFamily() != OsFamily.WINDOWS && status > 128 && status < 128 + 65) {
            exitCode = null;
            signal = signalName(status - 128);
        }

        var result = new ExecutionResult(stdout.asString(), stderr.asString(), exitCode, signal,
                timedOut, truncated.get(), elapsedMs, executorName);

        if (timedOut) {
            log.warn("Execution of {} timed out after {} ms", executable.getFileName(), options.timeMs());
        } else if (result.truncated()) {
            log.warn("Execution of {} killed after exceeding {} output bytes (stdout {}, stderr {})",
                    executable.getFileName(), options.maxOutputBytes(), stdout.totalSeen(), stderr.totalSeen());
        }
        if (!result.exitedCleanly()) {
            writeDiagnostics(debugLog, command, env, result);
        }
        log.info("Execution of {} finished in {} ms (exit={}, signal={})",
                executable.getFileName(), elapsedMs, exitCode, signal);
        return result;
    }

    static String signalName(int number) {
        return SIGNAL_NAMES.getOrDefault(number, "SIG" + number);
    }

    private static void closeStdin(Process process) {
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of child process: {}", e.getMessage());
        }
    }

    private static Thread drain(String streamName, InputStream in, CappedOutputSink sink,
                                AtomicBoolean truncated, Runnable terminate) {
        Thread thread = new Thread(() -> {
            byte[] buf = new byte[DRAIN_BUFFER_BYTES];
            try (in) {
                int n;
                while ((n = in.read(buf)) != -1) {
                    if (!sink.write(buf, n) && truncated.compareAndSet(false, true)) {
                        terminate.run();
                    }
                }
            } catch (IOException e) {
                // the stream closes underneath us when the process is killed
                log.debug("{} drain ended: {}", streamName, e.getMessage());
            }
        }, "sandbox-" + streamName);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private void writeDiagnostics(Path debugLog, List<String> command, Map<String, String> env,
                                  ExecutionResult result) {
        if (debugLog == null) {
            return;
        }
        var debug = new LinkedHashMap<String, Object>();
        debug.put("command", command);
        debug.put("environmentKeys", new TreeSet<>(env.keySet()));
        debug.put("libraryPathVariables", libraryVariables(env));
        debug.put("os", platformAdapter.osFamily().name());
        debug.put("arch", System.getProperty("os.arch"));
        debug.put("exitCode", result.exitCode());
        debug.put("signal", result.signal());
        debug.put("timedOut", result.timedOut());
        debug.put("truncated", result.truncated());
        debug.put("elapsedMs", result.elapsedMs());
        debug.put("stdout", result.stdout());
        debug.put("stderr", result.stderr());
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(debugLog.toFile(), debug);
            log.info("Diagnostics written to {}", debugLog);
        } catch (IOException e) {
            log.warn("Could not write diagnostics to {}: {}", debugLog, e.getMessage());
        }
    }

    private static Map<String, String> libraryVariables(Map<String, String> env) {
        var vars = new LinkedHashMap<String, String>();
        for (String key : List.of("LD_LIBRARY_PATH", "DYLD_LIBRARY_PATH", "LC_ALL", "TZ", "TRACE_OUTPUT")) {
            if (env.containsKey(key)) {
                vars.put(key, env.get(key));
            }
        }
        return vars;
    }
}
