package com.neutrala.compile;

import com.neutrala.core.TracerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessToolInvokerTest {

    @TempDir
    Path workDir;

    @Test
    @DisplayName("Combined output and exit status are returned")
    void capturesOutputAndExitCode() {
        var result = new ProcessToolInvoker(10).run(
                List.of("/bin/sh", "-c", "echo compiling; echo 'error: boom' >&2; exit 3"), workDir);

        assertEquals(3, result.exitCode());
        assertFalse(result.succeeded());
        assertTrue(result.output().contains("compiling\n"));
        assertTrue(result.output().contains("error: boom\n"));
    }

    @Test
    @DisplayName("A tool that hangs is killed once the timeout expires")
    void hungToolIsKilled() {
        long started = System.nanoTime();

        var ex = assertThrows(TracerException.class, () ->
                new ProcessToolInvoker(1).run(List.of("/bin/sh", "-c", "echo started; sleep 10; echo late"), workDir));

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        assertTrue(elapsedMs < 5_000, "returned after " + elapsedMs + " ms");
        assertTrue(ex.getMessage().contains("did not finish within 1s"));
    }

    @Test
    @DisplayName("A missing binary fails to spawn")
    void missingBinary() {
        var ex = assertThrows(TracerException.class, () ->
                new ProcessToolInvoker(1).run(List.of("/nonexistent/clang"), workDir));

        assertTrue(ex.getMessage().startsWith("Failed to spawn /nonexistent/clang"));
    }
}
