package com.neutrala.steps;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An event captured inside a loop body buffer. Carries only a buffer-local index; it has no
 * global step index and never becomes a {@link Step} of its own.
 *
 * @param internalStepIndex position within the owning loop's buffer, from 0
 * @param iteration         iteration of the owning loop that produced the event
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"internalStepIndex", "iteration", "eventType", "file", "line", "function", "frameId", "payload"})
public record InternalEvent(
        int internalStepIndex,
        Integer iteration,
        String eventType,
        String file,
        int line,
        String function,
        String frameId,
        Map<String, Object> payload
) {

    public InternalEvent {
        payload = payload == null || payload.isEmpty()
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public Object payloadValue(String key) {
        return payload == null ? null : payload.get(key);
    }
}
