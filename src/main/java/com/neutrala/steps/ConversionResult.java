package com.neutrala.steps;

import com.neutrala.trace.TraceWarning;

import java.util.List;

public record ConversionResult(List<Step> steps, List<TraceWarning> warnings) {

    public ConversionResult {
        steps = List.copyOf(steps);
        warnings = List.copyOf(warnings);
    }
}
