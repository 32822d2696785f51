package com.neutrala.toolchain;

import com.neutrala.core.TracerException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The bundled toolchain is incomplete. Fatal for the request: nothing can be compiled.
 */
public class ToolchainMissingException extends TracerException {

    private final List<ToolchainCheck> failedChecks;

    public ToolchainMissingException(List<ToolchainCheck> failedChecks) {
        super("Toolchain incomplete: " + failedChecks.stream()
                .map(c -> c.name() + " (" + c.detail() + ")")
                .collect(Collectors.joining(", ")));
        this.failedChecks = List.copyOf(failedChecks);
    }

    public List<ToolchainCheck> getFailedChecks() {
        return failedChecks;
    }
}
