package com.neutrala.sandbox;

/**
 * Limits for one execution.
 *
 * @param timeMs         wall-clock budget before the process is killed
 * @param maxOutputBytes per-stream cap on captured stdout/stderr
 * @param memoryBytes    optional address-space ceiling (0 = none), hard limits only
 * @param cpuSeconds     optional CPU-time ceiling (0 = none), hard limits only
 */
public record ExecutionOptions(long timeMs, long maxOutputBytes, long memoryBytes, long cpuSeconds) {

    public static final long DEFAULT_TIME_MS = 2000;
    public static final long DEFAULT_MAX_OUTPUT_BYTES = 1024 * 1024;

    public ExecutionOptions {
        if (timeMs <= 0) timeMs = DEFAULT_TIME_MS;
        if (maxOutputBytes <= 0) maxOutputBytes = DEFAULT_MAX_OUTPUT_BYTES;
        if (memoryBytes < 0) memoryBytes = 0;
        if (cpuSeconds < 0) cpuSeconds = 0;
    }

    public static ExecutionOptions defaults() {
        return new ExecutionOptions(DEFAULT_TIME_MS, DEFAULT_MAX_OUTPUT_BYTES, 0, 0);
    }

    public ExecutionOptions withTimeMs(long newTimeMs) {
        return new ExecutionOptions(newTimeMs, maxOutputBytes, memoryBytes, cpuSeconds);
    }

    public boolean hasHardLimits() {
        return memoryBytes > 0 || cpuSeconds > 0;
    }
}
