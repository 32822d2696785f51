package com.neutrala.steps;

import java.util.ArrayList;
import java.util.List;

/**
 * Bookkeeping for one active loop. Lives on a {@link LoopStack} for the duration of a single
 * conversion. {@code parentLoopId} is informational only; the parent is the entry below this
 * one on the stack.
 */
public final class LoopContext {

    private final int loopId;
    private final String loopType;
    private final Integer parentLoopId;
    private final StepOrigin origin;
    private final List<InternalEvent> buffer = new ArrayList<>();
    private int iterationCounter;

    LoopContext(int loopId, String loopType, Integer parentLoopId, StepOrigin origin) {
        this.loopId = loopId;
        this.loopType = loopType;
        this.parentLoopId = parentLoopId;
        this.origin = origin;
    }

    public int loopId() {
        return loopId;
    }

    public String loopType() {
        return loopType;
    }

    public Integer parentLoopId() {
        return parentLoopId;
    }

    /**
     * Where the loop started: file, line and call frame used for its summary step.
     */
    StepOrigin origin() {
        return origin;
    }

    public int iterationCounter() {
        return iterationCounter;
    }

    int beginIteration() {
        return ++iterationCounter;
    }

    int bufferSize() {
        return buffer.size();
    }

    void append(InternalEvent event) {
        buffer.add(event);
    }

    public List<InternalEvent> buffer() {
        return List.copyOf(buffer);
    }
}
