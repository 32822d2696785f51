package com.neutrala.steps;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One unit of the execution narrative handed to the rendering layer.
 *
 * @param stepIndex global position, assigned at emission and increasing by one per step
 * @param eventType step kind, e.g. {@code func_enter}, {@code var_assign}, {@code loop_body_summary}
 * @param timestamp strictly increasing across the whole sequence
 * @param file      source file name without directories
 * @param line      source line, 0 for synthetic steps
 * @param function  function the step belongs to
 * @param frameId   call frame identifier, {@code <function>-<n>}
 * @param callDepth 0 for {@code main}
 * @param loopId    set for loop steps and summaries
 * @param loopType  set for {@code loop_start} and summaries
 * @param iteration set for {@code loop_body_start}, {@code loop_iteration_end} and summaries
 * @param events    buffered loop body, only on {@code loop_body_summary}
 * @param payload   kind-specific fields copied from the trace record
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"stepIndex", "eventType", "timestamp", "file", "line", "function", "frameId", "callDepth",
        "loopId", "loopType", "iteration", "events", "payload"})
public record Step(
        int stepIndex,
        String eventType,
        long timestamp,
        String file,
        int line,
        String function,
        String frameId,
        int callDepth,
        Integer loopId,
        String loopType,
        Integer iteration,
        List<InternalEvent> events,
        Map<String, Object> payload
) {

    public Step {
        events = events == null ? null : List.copyOf(events);
        payload = payload == null || payload.isEmpty()
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public Object payloadValue(String key) {
        return payload == null ? null : payload.get(key);
    }
}
