package com.neutrala.sandbox;

import com.neutrala.core.TracerException;

/**
 * The program could not be started or supervised.
 */
public class SandboxException extends TracerException {
    public SandboxException(String message) {
        super(message);
    }

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
