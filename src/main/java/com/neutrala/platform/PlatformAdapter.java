package com.neutrala.platform;

import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;
import java.util.regex.Pattern;

/**
 * Normalizes compiler flags, paths, process environment and timestamps so that trace
 * output is reproducible regardless of the host operating system.
 *
 * <p>All methods are pure functions of their inputs plus the fixed {@link OsFamily}
 * and deterministic-mode flag this adapter was built with.
 */
public class PlatformAdapter {

    /** Flags every instrumented compile needs, in this order, ahead of user flags. */
    public static final List<String> REQUIRED_FLAGS = List.of(
            "-g",
            "-O0",
            "-fno-omit-frame-pointer",
            "-finstrument-functions"
    );

    /** Any optimization level other than -O0. */
    private static final Pattern ELEVATED_OPTIMIZATION = Pattern.compile("^-O(?!0$).*");

    private final OsFamily osFamily;
    private final boolean deterministic;
    private final LongSupplier wallClockMicros;

    public PlatformAdapter(OsFamily osFamily, boolean deterministic) {
        this(osFamily, deterministic, () -> ChronoUnit.MICROS.between(Instant.EPOCH, Instant.now()));
    }

    PlatformAdapter(OsFamily osFamily, boolean deterministic, LongSupplier wallClockMicros) {
        this.osFamily = osFamily;
        this.deterministic = deterministic;
        this.wallClockMicros = wallClockMicros;
    }

    public OsFamily osFamily() {
        return osFamily;
    }

    public boolean isDeterministic() {
        return deterministic;
    }

    /**
     * Prepends the instrumentation flags and drops user flags that contradict them.
     * No other deduplication happens: flags such as {@code -isystem <dir>} are positional.
     */
    public List<String> normalizeFlags(List<String> userFlags) {
        var result = new ArrayList<String>(REQUIRED_FLAGS);
        if (userFlags == null) {
            return result;
        }
        for (String flag : userFlags) {
            if (flag == null) continue;
            if (ELEVATED_OPTIMIZATION.matcher(flag).matches()) continue;
            if ("-fomit-frame-pointer".equals(flag)) continue;
            result.add(flag);
        }
        return result;
    }

    /**
     * Absolute, forward-slash separated form of a path. Empty input gives an empty string.
     */
    public String normalizePath(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        return Path.of(path).toAbsolutePath().normalize().toString().replace('\\', '/');
    }

    /**
     * Copies {@code baseEnv} and injects the dynamic-library search variable for this OS,
     * plus a fixed locale and timezone.
     */
    public Map<String, String> buildExecutionEnvironment(Map<String, String> baseEnv, List<Path> libraryPaths) {
        var env = new HashMap<String, String>(baseEnv == null ? Map.of() : baseEnv);
        String variable = switch (osFamily) {
            case WINDOWS -> "PATH";
            case MACOS -> "DYLD_LIBRARY_PATH";
            case LINUX -> "LD_LIBRARY_PATH";
        };
        String separator = osFamily == OsFamily.WINDOWS ? ";" : ":";

        var entries = new ArrayList<String>();
        if (libraryPaths != null) {
            for (Path p : libraryPaths) {
                entries.add(p.toAbsolutePath().normalize().toString());
            }
        }
        String current = env.get(variable);
        if (current != null && !current.isEmpty()) {
            entries.add(current);
        }
        env.put(variable, String.join(separator, entries));

        env.put("LC_ALL", "C");
        env.put("TZ", "UTC");
        return env;
    }

    /**
     * Wall-clock microseconds, or {@code counter * 1000} in deterministic mode.
     */
    public long timestamp(long counter) {
        if (deterministic) {
            return counter * 1000L;
        }
        return wallClockMicros.getAsLong();
    }

    public String executableFileName(String baseName) {
        return osFamily == OsFamily.WINDOWS ? baseName + ".exe" : baseName;
    }
}
