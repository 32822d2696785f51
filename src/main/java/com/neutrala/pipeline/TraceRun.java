package com.neutrala.pipeline;

import com.neutrala.sandbox.ExecutionResult;
import com.neutrala.steps.Step;
import com.neutrala.trace.TraceWarning;

import java.util.List;

/**
 * Everything a request produced: the step sequence plus the execution summary.
 *
 * @param sessionId          session the artifacts were written to
 * @param steps              ordered steps for the rendering layer
 * @param execution          stdout/stderr, exit status and halt flags
 * @param warnings           anomalies absorbed while parsing and converting
 * @param compileDiagnostics compiler warnings from a successful build, may be empty
 * @param traceComplete      the trace artifact ended with its footer
 */
public record TraceRun(
        String sessionId,
        List<Step> steps,
        ExecutionResult execution,
        List<TraceWarning> warnings,
        String compileDiagnostics,
        boolean traceComplete
) {

    public TraceRun {
        steps = List.copyOf(steps);
        warnings = List.copyOf(warnings);
    }
}
