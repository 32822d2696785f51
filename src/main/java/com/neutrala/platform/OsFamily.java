package com.neutrala.platform;

import java.util.Locale;

/**
 * Operating system families the tracer knows how to run on.
 */
public enum OsFamily {
    WINDOWS("windows"),
    MACOS("macos"),
    LINUX("linux");

    private final String directoryName;

    OsFamily(String directoryName) {
        this.directoryName = directoryName;
    }

    /**
     * Name of the per-platform directory inside the toolchain layout.
     */
    public String directoryName() {
        return directoryName;
    }

    public boolean isPosix() {
        return this != WINDOWS;
    }

    public static OsFamily current() {
        return detect(System.getProperty("os.name", ""));
    }

    /**
     * Maps an {@code os.name} value to a family. Anything that is neither Windows nor macOS
     * is treated as Linux.
     */
    public static OsFamily detect(String osName) {
        String name = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        if (name.startsWith("windows")) return WINDOWS;
        if (name.contains("mac") || name.contains("darwin")) return MACOS;
        return LINUX;
    }
}
