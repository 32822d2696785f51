package com.neutrala.trace;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Record kinds written by the instrumentation runtime. The wire name is the
 * {@code type} discriminant of each record.
 */
public enum TraceEventType {
    FUNC_ENTER("func_enter"),
    FUNC_EXIT("func_exit"),
    LOOP_START("loop_start"),
    LOOP_BODY_START("loop_body_start"),
    LOOP_ITERATION_END("loop_iteration_end"),
    LOOP_CONDITION("loop_condition"),
    LOOP_END("loop_end"),
    ASSIGN("assign"),
    VAR("var"),
    DECLARE("declare"),
    ARRAY_CREATE("array_create"),
    ARRAY_INDEX_ASSIGN("array_index_assign"),
    OUTPUT_FLUSH("output_flush"),
    CONDITION_EVAL("condition_eval"),
    BRANCH_TAKEN("branch_taken"),
    CONTROL_FLOW("control_flow"),
    BLOCK_ENTER("block_enter"),
    BLOCK_EXIT("block_exit"),
    RETURN("return"),
    HEAP_ALLOC("heap_alloc"),
    HEAP_FREE("heap_free"),
    HEAP_WRITE("heap_write"),
    POINTER_ALIAS("pointer_alias"),
    POINTER_DEREF_WRITE("pointer_deref_write"),
    ARG_BIND("arg_bind"),
    EXPRESSION_EVAL("expression_eval");

    private static final Map<String, TraceEventType> BY_WIRE_NAME = new HashMap<>();

    static {
        for (TraceEventType type : values()) {
            BY_WIRE_NAME.put(type.wireName, type);
        }
    }

    private final String wireName;

    TraceEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Loop-control records carry a {@code loopId} and drive the loop-context stack.
     */
    public boolean isLoopControl() {
        return switch (this) {
            case LOOP_START, LOOP_BODY_START, LOOP_ITERATION_END, LOOP_CONDITION, LOOP_END -> true;
            default -> false;
        };
    }

    /**
     * Structural events are always emitted as top-level steps and never buffered into a loop body.
     */
    public boolean isStructural() {
        return switch (this) {
            case FUNC_ENTER, FUNC_EXIT, RETURN, LOOP_START, LOOP_BODY_START, LOOP_ITERATION_END,
                 LOOP_CONDITION, LOOP_END, BLOCK_ENTER, BLOCK_EXIT, ARRAY_CREATE -> true;
            default -> false;
        };
    }

    public static Optional<TraceEventType> fromWire(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName.toLowerCase(Locale.ROOT)));
    }
}
