package com.neutrala.trace;

import com.neutrala.core.TracerException;

import java.nio.file.Path;

/**
 * The trace artifact is missing or cannot be read, so there is nothing to convert.
 */
public class UnreadableTraceArtifactException extends TracerException {

    private final Path artifact;

    public UnreadableTraceArtifactException(Path artifact, String message) {
        super(message);
        this.artifact = artifact;
    }

    public UnreadableTraceArtifactException(Path artifact, String message, Throwable cause) {
        super(message, cause);
        this.artifact = artifact;
    }

    public Path getArtifact() {
        return artifact;
    }
}
