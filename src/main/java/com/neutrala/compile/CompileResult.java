package com.neutrala.compile;

import java.nio.file.Path;

/**
 * @param executablePath linked, instrumented program
 * @param diagnostics    warnings printed by the toolchain (empty when silent)
 */
public record CompileResult(Path executablePath, String diagnostics) {}
