package com.neutrala.steps;

import java.util.ArrayList;
import java.util.List;

/**
 * LIFO stack of active loops, addressed by index. Index 0 is the outermost loop; a context's
 * parent is the entry at {@code index - 1}. Contexts never reference each other.
 */
public final class LoopStack {

    private final List<LoopContext> contexts = new ArrayList<>();

    LoopContext push(int loopId, String loopType, StepOrigin origin) {
        LoopContext top = peek();
        var context = new LoopContext(loopId, loopType, top == null ? null : top.loopId(), origin);
        contexts.add(context);
        return context;
    }

    /**
     * Top of stack, or {@code null} when no loop is active.
     */
    LoopContext peek() {
        return contexts.isEmpty() ? null : contexts.get(contexts.size() - 1);
    }

    boolean isTop(Integer loopId) {
        LoopContext top = peek();
        return top != null && loopId != null && top.loopId() == loopId;
    }

    LoopContext pop() {
        if (contexts.isEmpty()) {
            throw new IllegalStateException("Loop stack is empty");
        }
        return contexts.remove(contexts.size() - 1);
    }

    /**
     * The enclosing loop of the context at {@code index}, or {@code null} for the outermost.
     */
    LoopContext parentOf(int index) {
        return index > 0 ? contexts.get(index - 1) : null;
    }

    boolean isEmpty() {
        return contexts.isEmpty();
    }

    int depth() {
        return contexts.size();
    }
}
