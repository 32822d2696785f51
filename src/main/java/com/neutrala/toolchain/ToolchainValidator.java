package com.neutrala.toolchain;

/**
 * Checks that a toolchain layout is usable before anything is compiled against it.
 */
public interface ToolchainValidator {

    ToolchainReport validate(ToolchainLayout layout);

    /**
     * @throws ToolchainMissingException naming every failed check
     */
    default void requireValid(ToolchainLayout layout) {
        ToolchainReport report = validate(layout);
        if (!report.ok()) {
            throw new ToolchainMissingException(report.failed());
        }
    }
}
