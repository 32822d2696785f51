package com.neutrala.trace;

import java.util.List;

/**
 * Result of decoding one trace artifact.
 *
 * @param events           valid records in artifact order
 * @param trackedFunctions function names listed in the footer, empty when the footer is missing
 * @param warnings         one entry per skipped record plus artifact-level anomalies
 * @param skippedRecords   records that were dropped
 * @param complete         the footer was read, so no trailing records were lost
 */
public record ParsedTrace(
        List<TraceEvent> events,
        List<String> trackedFunctions,
        List<TraceWarning> warnings,
        int skippedRecords,
        boolean complete
) {

    public ParsedTrace {
        events = List.copyOf(events);
        trackedFunctions = List.copyOf(trackedFunctions);
        warnings = List.copyOf(warnings);
    }

    public static ParsedTrace empty(List<TraceWarning> warnings) {
        return new ParsedTrace(List.of(), List.of(), warnings, 0, false);
    }
}
