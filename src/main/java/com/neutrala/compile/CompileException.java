package com.neutrala.compile;

import com.neutrala.core.TracerException;

/**
 * The toolchain rejected the program. Carries the diagnostics exactly as the compiler printed them.
 */
public class CompileException extends TracerException {

    private final String stage;
    private final String diagnostics;

    public CompileException(String stage, String diagnostics) {
        super(stage + " failed:\n" + diagnostics);
        this.stage = stage;
        this.diagnostics = diagnostics;
    }

    public String getStage() {
        return stage;
    }

    public String getDiagnostics() {
        return diagnostics;
    }
}
