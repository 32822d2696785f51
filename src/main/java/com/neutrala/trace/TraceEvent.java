package com.neutrala.trace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One decoded trace record. Ordering is the record's position in the artifact.
 *
 * @param sequence   record {@code id} as written by the runtime
 * @param type       decoded kind
 * @param function   enclosing function name, {@code "unknown"} when the runtime had none
 * @param file       source file, may be {@code null} for function boundary records
 * @param line       source line, 0 when unknown
 * @param depth      runtime call depth
 * @param timestamp  runtime timestamp in microseconds
 * @param loopId     loop identifier for loop-control records, otherwise {@code null}
 * @param attributes every other field of the record, in artifact order
 */
public record TraceEvent(
        long sequence,
        TraceEventType type,
        String function,
        String file,
        int line,
        int depth,
        long timestamp,
        Integer loopId,
        Map<String, Object> attributes
) {

    public TraceEvent {
        // attribute values may be JSON null
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }

    public String stringAttribute(String key) {
        Object value = attributes.get(key);
        return value == null ? null : value.toString();
    }

    public String loopType() {
        return stringAttribute("loopType");
    }

    public String name() {
        return stringAttribute("name");
    }

    public Object value() {
        return attributes.get("value");
    }
}
