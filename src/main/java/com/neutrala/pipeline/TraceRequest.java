package com.neutrala.pipeline;

import com.neutrala.compile.Language;
import com.neutrala.sandbox.ExecutionOptions;

import java.util.List;

/**
 * One compile-and-trace request.
 *
 * @param sourceText program source
 * @param language   selects driver and file extension
 * @param flags      extra compiler flags, conflicting ones are dropped
 * @param options    execution limits, {@code null} for the configured defaults
 */
public record TraceRequest(String sourceText, Language language, List<String> flags, ExecutionOptions options) {

    public TraceRequest {
        if (sourceText == null) {
            throw new IllegalArgumentException("sourceText is required");
        }
        if (language == null) {
            throw new IllegalArgumentException("language is required");
        }
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    public static TraceRequest of(String sourceText, Language language) {
        return new TraceRequest(sourceText, language, List.of(), null);
    }
}
