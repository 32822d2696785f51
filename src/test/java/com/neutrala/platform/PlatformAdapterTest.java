package com.neutrala.platform;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlatformAdapterTest {

    private final PlatformAdapter linux = new PlatformAdapter(OsFamily.LINUX, false);

    @Nested
    @DisplayName("normalizeFlags")
    class NormalizeFlags {

        @Test
        @DisplayName("Required flags come first, in order")
        void requiredFlagsFirst() {
            List<String> flags = linux.normalizeFlags(List.of("-Wall"));
            assertEquals(List.of("-g", "-O0", "-fno-omit-frame-pointer", "-finstrument-functions", "-Wall"), flags);
        }

        @Test
        @DisplayName("Elevated optimization levels and frame-pointer omission are dropped")
        void conflictingFlagsDropped() {
            List<String> flags = linux.normalizeFlags(
                    List.of("-O2", "-O", "-Os", "-Ofast", "-fomit-frame-pointer", "-O0", "-DDEBUG=1"));
            assertEquals(List.of("-g", "-O0", "-fno-omit-frame-pointer", "-finstrument-functions", "-O0", "-DDEBUG=1"),
                    flags);
        }

        @Test
        @DisplayName("Positional flags keep their argument and order")
        void positionalFlagsKept() {
            List<String> flags = linux.normalizeFlags(List.of("-isystem", "/a", "-isystem", "/a"));
            assertEquals(List.of("-isystem", "/a", "-isystem", "/a"), flags.subList(4, flags.size()));
        }

        @Test
        @DisplayName("Null user flags give just the required flags")
        void nullUserFlags() {
            assertEquals(PlatformAdapter.REQUIRED_FLAGS, linux.normalizeFlags(null));
        }
    }

    @Nested
    @DisplayName("buildExecutionEnvironment")
    class BuildEnvironment {

        @Test
        @DisplayName("Linux prepends library paths to LD_LIBRARY_PATH")
        void linuxLibraryPath() {
            Map<String, String> env = linux.buildExecutionEnvironment(
                    Map.of("LD_LIBRARY_PATH", "/usr/lib"), List.of(Path.of("/opt/tc/lib")));
            assertEquals("/opt/tc/lib:/usr/lib", env.get("LD_LIBRARY_PATH"));
            assertEquals("C", env.get("LC_ALL"));
            assertEquals("UTC", env.get("TZ"));
        }

        @Test
        @DisplayName("macOS uses DYLD_LIBRARY_PATH")
        void macLibraryPath() {
            var mac = new PlatformAdapter(OsFamily.MACOS, false);
            Map<String, String> env = mac.buildExecutionEnvironment(Map.of(), List.of(Path.of("/opt/tc/lib")));
            assertEquals("/opt/tc/lib", env.get("DYLD_LIBRARY_PATH"));
            assertFalse(env.containsKey("LD_LIBRARY_PATH"));
        }

        @Test
        @DisplayName("Windows prepends to PATH with ';'")
        void windowsPath() {
            var windows = new PlatformAdapter(OsFamily.WINDOWS, false);
            Map<String, String> env = windows.buildExecutionEnvironment(
                    Map.of("PATH", "C:/Windows"), List.of(Path.of("tc")));
            String path = env.get("PATH");
            assertTrue(path.endsWith(";C:/Windows"), path);
            assertTrue(path.startsWith(Path.of("tc").toAbsolutePath().toString()), path);
        }

        @Test
        @DisplayName("The base environment is not mutated")
        void baseNotMutated() {
            var base = new HashMap<String, String>();
            base.put("HOME", "/home/u");
            Map<String, String> env = linux.buildExecutionEnvironment(base, List.of());
            assertEquals(1, base.size());
            assertEquals("/home/u", env.get("HOME"));
            assertEquals("", env.get("LD_LIBRARY_PATH"));
        }
    }

    @Test
    @DisplayName("Deterministic mode derives timestamps from the counter")
    void deterministicTimestamps() {
        var adapter = new PlatformAdapter(OsFamily.LINUX, true, () -> 42L);
        assertEquals(1000, adapter.timestamp(1));
        assertEquals(7000, adapter.timestamp(7));
    }

    @Test
    @DisplayName("Default mode uses the wall clock")
    void wallClockTimestamps() {
        var adapter = new PlatformAdapter(OsFamily.LINUX, false, () -> 42L);
        assertEquals(42, adapter.timestamp(1));
        assertEquals(42, adapter.timestamp(2));
    }

    @Test
    @DisplayName("Wall-clock timestamps are epoch microseconds")
    void wallClockIsEpochMicros() {
        long before = System.currentTimeMillis() * 1000L;
        long timestamp = linux.timestamp(1);
        long after = (System.currentTimeMillis() + 1) * 1000L;

        assertTrue(timestamp >= before && timestamp <= after, before + " <= " + timestamp + " <= " + after);
    }

    @Test
    @EnabledOnOs(OS.LINUX)
    @DisplayName("Wall-clock timestamps resolve below a millisecond")
    void wallClockResolvesMicros() {
        boolean subMillisecond = false;
        for (int i = 0; i < 1000 && !subMillisecond; i++) {
            subMillisecond = linux.timestamp(i) % 1000 != 0;
        }
        assertTrue(subMillisecond);
    }

    @Test
    @DisplayName("normalizePath gives absolute forward-slash paths")
    void normalizePath() {
        assertEquals("", linux.normalizePath(""));
        assertEquals("", linux.normalizePath(null));
        String normalized = linux.normalizePath("a/../b/c.cpp");
        assertTrue(normalized.endsWith("/b/c.cpp"), normalized);
        assertFalse(normalized.contains("\\"));
        assertTrue(Path.of(normalized).isAbsolute());
    }

    @Test
    @DisplayName("Executable names get .exe only on Windows")
    void executableFileName() {
        assertEquals("exec_1", linux.executableFileName("exec_1"));
        assertEquals("exec_1.exe", new PlatformAdapter(OsFamily.WINDOWS, false).executableFileName("exec_1"));
    }
}
