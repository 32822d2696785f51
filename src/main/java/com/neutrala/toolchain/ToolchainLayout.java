package com.neutrala.toolchain;

import com.neutrala.platform.OsFamily;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Read-only view of a bundled toolchain directory:
 * <pre>
 *   &lt;root&gt;/headers/                 shared headers (libc++ under c++/v1)
 *   &lt;root&gt;/&lt;platform&gt;/bin/           compiler driver, debugger, symbolizer
 *   &lt;root&gt;/&lt;platform&gt;/lib/           runtime libraries, clang/&lt;version&gt;/...
 *   &lt;root&gt;/&lt;platform&gt;/include/       platform headers
 * </pre>
 */
public class ToolchainLayout {

    private static final Logger log = LoggerFactory.getLogger(ToolchainLayout.class);

    private final Path root;
    private final OsFamily osFamily;

    public ToolchainLayout(Path root, OsFamily osFamily) {
        this.root = root.toAbsolutePath().normalize();
        this.osFamily = osFamily;
    }

    public Path root() { return root; }
    public OsFamily osFamily() { return osFamily; }

    public Path platformDir() {
        return root.resolve(osFamily.directoryName());
    }

    public Path binDir() {
        return platformDir().resolve("bin");
    }

    public Path libDir() {
        return platformDir().resolve("lib");
    }

    public Path headersDir() {
        return root.resolve("headers");
    }

    /**
     * Path of a driver binary such as {@code clang} or {@code clang++}.
     */
    public Path binary(String name) {
        return binDir().resolve(osFamily == OsFamily.WINDOWS ? name + ".exe" : name);
    }

    public List<String> includeFlags() {
        var flags = new ArrayList<String>();
        flags.add("-isystem");
        flags.add(headersDir().resolve("c++").resolve("v1").toString());
        flags.add("-isystem");
        flags.add(headersDir().toString());
        flags.add("-isystem");
        flags.add(platformDir().resolve("include").toString());
        for (String version : clangVersions()) {
            Path builtin = libDir().resolve("clang").resolve(version).resolve("include");
            if (Files.isDirectory(builtin)) {
                flags.add("-isystem");
                flags.add(builtin.toString());
            }
        }
        return flags;
    }

    /**
     * Existing runtime library directories, most specific first.
     */
    public List<Path> libraryDirs() {
        var dirs = new ArrayList<Path>();
        String runtimeDir = switch (osFamily) {
            case WINDOWS -> {
                dirs.add(platformDir().resolve(windowsTriple()).resolve("lib"));
                yield "windows";
            }
            case MACOS -> "darwin";
            case LINUX -> "linux";
        };
        dirs.add(libDir());
        List<String> versions = clangVersions();
        if (!versions.isEmpty()) {
            dirs.add(libDir().resolve("clang").resolve(versions.get(0)).resolve("lib").resolve(runtimeDir));
        }
        return dirs.stream().filter(Files::isDirectory).toList();
    }

    public List<String> linkerFlags() {
        var flags = new ArrayList<String>();
        for (Path dir : libraryDirs()) {
            flags.add("-L" + dir);
            if (osFamily.isPosix()) {
                flags.add("-Wl,-rpath," + dir);
            }
        }
        return flags;
    }

    /**
     * Versions found under {@code lib/clang}, newest first.
     */
    List<String> clangVersions() {
        Path base = libDir().resolve("clang");
        if (!Files.isDirectory(base)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(base)) {
            return entries.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .sorted(ToolchainLayout::compareVersionsDescending)
                    .toList();
        } catch (IOException e) {
            log.warn("Cannot list clang versions under {}: {}", base, e.getMessage());
            return List.of();
        }
    }

    private static int compareVersionsDescending(String a, String b) {
        String[] pa = a.split("\\.");
        String[] pb = b.split("\\.");
        for (int i = 0; i < Math.max(pa.length, pb.length); i++) {
            int da = i < pa.length ? parseOrZero(pa[i]) : 0;
            int db = i < pb.length ? parseOrZero(pb[i]) : 0;
            if (da != db) {
                return Integer.compare(db, da);
            }
        }
        return b.compareTo(a);
    }

    private static int parseOrZero(String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String windowsTriple() {
        String arch = System.getProperty("os.arch", "");
        if (arch.equals("x86") || arch.equals("i386")) return "i686-w64-mingw32";
        if (arch.equals("aarch64") || arch.equals("arm64")) return "aarch64-w64-mingw32";
        return "x86_64-w64-mingw32";
    }
}
