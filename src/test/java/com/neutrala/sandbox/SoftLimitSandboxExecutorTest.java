package com.neutrala.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.neutrala.trace.ParsedTrace;
import com.neutrala.trace.TraceParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class SoftLimitSandboxExecutorTest {

    @TempDir
    Path dir;

    private SoftLimitSandboxExecutor executor;
    private Path traceOutput;
    private Path debugLog;

    @BeforeEach
    void setUp() {
        executor = new SoftLimitSandboxExecutor(SandboxTestSupport.supervisor());
        traceOutput = dir.resolve("trace.json");
        debugLog = dir.resolve("trace_debug.json");
    }

    @Test
    @DisplayName("Clean run captures stdout and exports the normalized environment")
    void cleanRun() throws IOException {
        Path program = SandboxTestSupport.script(dir, "ok.sh",
                "echo \"$LC_ALL $TZ\"\nprintf '{}' > \"$TRACE_OUTPUT\"\necho oops >&2");

        ExecutionResult result = executor.execute(program, traceOutput, debugLog, ExecutionOptions.defaults());

        assertTrue(result.exitedCleanly());
        assertEquals(0, result.exitCode());
        assertNull(result.signal());
        assertEquals("C UTC\n", result.stdout());
        assertEquals("oops\n", result.stderr());
        assertEquals("soft", result.executor());
        assertTrue(Files.exists(traceOutput), "program must see TRACE_OUTPUT");
        assertFalse(Files.exists(debugLog), "no diagnostics for a clean run");
    }

    @Test
    @DisplayName("Timer kills a long-running program and flags the timeout")
    void timeout() throws IOException {
        Path program = SandboxTestSupport.script(dir, "sleepy.sh", "echo started\nexec sleep 10");

        ExecutionResult result = executor.execute(program, traceOutput, debugLog,
                ExecutionOptions.defaults().withTimeMs(300));

        assertTrue(result.timedOut());
        assertFalse(result.truncated());
        assertTrue(result.haltedEarly());
        assertNull(result.exitCode());
        assertEquals("SIGKILL", result.signal());
        assertTrue(result.elapsedMs() < 10_000);
        assertEquals("started\n", result.stdout());
    }

    @Test
    @DisplayName("Output past the cap is dropped, the program is killed, and the trace prefix still parses")
    void truncationKeepsTracePrefix() throws IOException, URISyntaxException {
        Path fixture = Path.of(Objects.requireNonNull(
                getClass().getResource("/traces/truncated.json")).toURI());
        Path program = SandboxTestSupport.script(dir, "chatty.sh",
                "cp '" + fixture + "' \"$TRACE_OUTPUT\"\n"
                        + "while true; do echo aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa; done");

        ExecutionResult result = executor.execute(program, traceOutput, debugLog,
                new ExecutionOptions(5000, 1024, 0, 0));

        assertTrue(result.truncated());
        assertFalse(result.timedOut());
        assertEquals(1024, result.stdout().length());

        ParsedTrace trace = new TraceParser(new ObjectMapper()).parse(traceOutput);
        assertEquals(14, trace.events().size());
        assertFalse(trace.complete());
    }

    @Test
    @DisplayName("Death by signal is reported as a signal name with diagnostics written")
    void signalReported() throws IOException {
        Path program = SandboxTestSupport.script(dir, "crash.sh", "echo before\nkill -SEGV $$");

        ExecutionResult result = executor.execute(program, traceOutput, debugLog, ExecutionOptions.defaults());

        assertNull(result.exitCode());
        assertEquals("SIGSEGV", result.signal());
        assertFalse(result.exitedCleanly());
        assertTrue(Files.exists(debugLog));
        var debug = new ObjectMapper().readTree(debugLog.toFile());
        assertEquals("SIGSEGV", debug.get("signal").asText());
        assertEquals("before\n", debug.get("stdout").asText());
        assertTrue(debug.get("environmentKeys").toString().contains("TRACE_OUTPUT"));
    }

    @Test
    @DisplayName("Non-zero exit keeps the exit code")
    void nonZeroExit() throws IOException {
        Path program = SandboxTestSupport.script(dir, "fail.sh", "exit 3");

        ExecutionResult result = executor.execute(program, traceOutput, debugLog, ExecutionOptions.defaults());

        assertEquals(3, result.exitCode());
        assertNull(result.signal());
        assertFalse(result.haltedEarly());
        assertTrue(Files.exists(debugLog));
    }

    @Test
    @DisplayName("A program that cannot be spawned raises SandboxException")
    void spawnFailure() {
        assertThrows(SandboxException.class, () ->
                executor.execute(dir.resolve("missing"), traceOutput, debugLog, ExecutionOptions.defaults()));
    }
}
