package com.neutrala.trace;

/**
 * An anomaly absorbed while parsing or converting a trace. Conversion always continues.
 *
 * @param kind     what went wrong
 * @param sequence record id or line number of the offending record, -1 when not applicable
 * @param loopId   offending loop, {@code null} when not loop related
 * @param message  human readable detail
 */
public record TraceWarning(Kind kind, long sequence, Integer loopId, String message) {

    public enum Kind {
        /** Record could not be decoded (truncated line, bad JSON, missing discriminant). */
        MALFORMED_RECORD,
        /** Record decoded but its kind is not known. */
        UNKNOWN_KIND,
        /** Loop event does not match the loop on top of the stack. */
        MALFORMED_LOOP,
        /** Loop still open when the event stream ended. */
        UNTERMINATED_LOOP,
        /** Artifact has no footer, the run was cut short. */
        INCOMPLETE_ARTIFACT,
        /** func_exit with no open frame. */
        UNBALANCED_FRAME
    }

    public static TraceWarning of(Kind kind, long sequence, String message) {
        return new TraceWarning(kind, sequence, null, message);
    }

    public static TraceWarning loop(Kind kind, long sequence, Integer loopId, String message) {
        return new TraceWarning(kind, sequence, loopId, message);
    }
}
