package com.neutrala.compile;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs one toolchain command to completion.
 */
@FunctionalInterface
public interface ToolInvoker {

    /**
     * @param exitCode process exit status
     * @param output   combined stdout/stderr
     */
    record ToolResult(int exitCode, String output) {
        public boolean succeeded() {
            return exitCode == 0;
        }
    }

    ToolResult run(List<String> command, Path workDir);
}
