package com.neutrala.core;

/**
 * Base type for failures that abort one compile/execute/parse request.
 */
public class TracerException extends RuntimeException {
    public TracerException(String message) {
        super(message);
    }

    public TracerException(String message, Throwable cause) {
        super(message, cause);
    }
}
