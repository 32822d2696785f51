package com.neutrala.steps;

/**
 * Inputs to a conversion besides the events themselves.
 *
 * @param sourceFile user source file; events from it are never treated as library noise
 * @param stdout     captured program output, one {@code output} step per non-empty line
 */
public record ConversionContext(String sourceFile, String stdout) {

    public ConversionContext {
        stdout = stdout == null ? "" : stdout;
    }
}
