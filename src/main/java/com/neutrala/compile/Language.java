package com.neutrala.compile;

import java.util.Locale;

public enum Language {
    C("c", "clang"),
    CPP("cpp", "clang++");

    private final String extension;
    private final String driver;

    Language(String extension, String driver) {
        this.extension = extension;
        this.driver = driver;
    }

    public String extension() { return extension; }

    /** Compiler driver binary name inside the toolchain's bin directory. */
    public String driver() { return driver; }

    /**
     * Accepts {@code c}, {@code cpp}, {@code c++}, {@code cxx} and {@code cc}, case-insensitively.
     */
    public static Language fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Language must not be null");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "c" -> C;
            case "cpp", "c++", "cxx", "cc" -> CPP;
            default -> throw new IllegalArgumentException("Unsupported language: " + name);
        };
    }
}
