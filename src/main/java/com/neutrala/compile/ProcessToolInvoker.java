package com.neutrala.compile;

import com.neutrala.core.TracerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link ToolInvoker} backed by a child process. Output is collected on a daemon thread
 * while the caller waits for the exit status; a tool that outlives the timeout is killed
 * together with its descendants.
 */
public class ProcessToolInvoker implements ToolInvoker {

    private static final Logger log = LoggerFactory.getLogger(ProcessToolInvoker.class);

    private static final long DRAIN_JOIN_MS = 2_000;

    private final long timeoutSeconds;

    public ProcessToolInvoker(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public ToolResult run(List<String> command, Path workDir) {
        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new TracerException("Failed to spawn " + command.get(0) + ": " + e.getMessage(), e);
        }

        StringBuffer output = new StringBuffer();
        Thread drain = drain(command.get(0), process, output);
        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                kill(process);
                drain.join(DRAIN_JOIN_MS);
                log.warn("{} killed after {}s", command.get(0), timeoutSeconds);
                throw new TracerException(command.get(0) + " did not finish within " + timeoutSeconds + "s");
            }
            drain.join(DRAIN_JOIN_MS);
            return new ToolResult(process.exitValue(), output.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            kill(process);
            throw new TracerException("Interrupted while running " + command.get(0), e);
        }
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static Thread drain(String tool, Process process, StringBuffer output) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append('\n');
                    log.debug("[toolchain] {}", line);
                }
            } catch (IOException e) {
                // the stream closes underneath us when the tool is killed
                log.debug("{} output drain ended: {}", tool, e.getMessage());
            }
        }, "toolchain-output");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }
}
