package com.neutrala.session;

import com.neutrala.platform.OsFamily;
import com.neutrala.platform.PlatformAdapter;
import com.neutrala.platform.TraceProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SessionArtifactsTest {

    @TempDir
    Path workDir;

    @Test
    @DisplayName("All artifacts live in the session directory and carry the session id")
    void artifactNames() {
        var artifacts = SessionArtifacts.in(workDir, "abc", "cpp", "exec_abc");

        assertEquals(workDir.resolve("src_abc.cpp"), artifacts.sourceFile());
        assertEquals(workDir.resolve("src_abc.o"), artifacts.objectFile());
        assertEquals(workDir.resolve("tracer_abc.o"), artifacts.runtimeObjectFile());
        assertEquals(workDir.resolve("exec_abc"), artifacts.executable());
        assertEquals(workDir.resolve("trace_abc.json"), artifacts.traceOutput());
        assertEquals(workDir.resolve("trace_debug_abc.json"), artifacts.debugLog());
    }

    @Test
    @DisplayName("Allocator creates a fresh directory per session")
    void allocatorCreatesDirectory() {
        var properties = new TraceProperties();
        properties.setWorkDir(workDir.toString());
        var allocator = new SessionAllocator(properties, new PlatformAdapter(OsFamily.WINDOWS, false));

        SessionArtifacts first = allocator.allocate("c");
        SessionArtifacts second = allocator.allocate("c");

        assertTrue(Files.isDirectory(first.directory()));
        assertNotEquals(first.directory(), second.directory());
        assertEquals(workDir.toAbsolutePath().normalize(), first.directory().getParent());
        assertTrue(first.executable().getFileName().toString().endsWith(".exe"));
        assertTrue(first.sourceFile().getFileName().toString().endsWith(".c"));
    }
}
