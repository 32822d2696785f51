package com.neutrala.steps;

import com.neutrala.platform.PlatformAdapter;
import com.neutrala.trace.TraceEvent;
import com.neutrala.trace.TraceWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns the flat trace event stream into the ordered step sequence.
 *
 * <p>Outside any loop every event becomes a step immediately. Inside a loop, non-structural
 * events are buffered into the innermost active loop and emitted as a single
 * {@code loop_body_summary} step immediately before that loop's {@code loop_end}. Loops are
 * tracked on a strict LIFO {@link LoopStack}: a loop event that does not name the loop on top of
 * the stack is reported as a {@link TraceWarning.Kind#MALFORMED_LOOP} warning and emitted as a
 * plain top-level step without touching the stack.
 *
 * <p>Step indices and timestamps are assigned only when a step is emitted, so both are strictly
 * increasing over the whole output. All state lives in one {@code Conversion} per call; the
 * engine itself is stateless and safe to share.
 */
@Service
public class StepConversionEngine {

    private static final Logger log = LoggerFactory.getLogger(StepConversionEngine.class);

    private static final List<String> LIBRARY_HEADERS = List.of("ios", "ostream", "locale", "__locale", "streambuf");

    static final String MAIN = "main";

    private final PlatformAdapter platformAdapter;

    public StepConversionEngine(PlatformAdapter platformAdapter) {
        this.platformAdapter = platformAdapter;
    }

    public ConversionResult convertToSteps(List<TraceEvent> events, ConversionContext context) {
        var conversion = new Conversion(context);
        conversion.programStart();
        for (TraceEvent event : events) {
            conversion.accept(event);
        }
        conversion.flushOpenLoops();
        conversion.programOutput();
        conversion.programEnd();
        log.info("Converted {} trace events into {} steps ({} warnings)",
                events.size(), conversion.steps.size(), conversion.warnings.size());
        return new ConversionResult(conversion.steps, conversion.warnings);
    }

    /**
     * Strips directories so step content does not depend on where the session lived.
     */
    static String baseName(String file) {
        if (file == null || file.isEmpty()) {
            return file;
        }
        String normalized = file.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash < 0 ? normalized : normalized.substring(slash + 1);
    }

    private record Frame(String function, String frameId) {
    }

    private final class Conversion {

        private final List<Step> steps = new ArrayList<>();
        private final List<TraceWarning> warnings = new ArrayList<>();
        private final StepClock clock = new StepClock(platformAdapter);
        private final LoopStack loops = new LoopStack();
        private final List<Frame> frames = new ArrayList<>();
        private final Map<String, Integer> frameCounts = new HashMap<>();
        private final String sourceFile;
        private final String stdout;
        private boolean mainEntered;

        Conversion(ConversionContext context) {
            this.sourceFile = baseName(context.sourceFile());
            this.stdout = context.stdout();
        }

        void programStart() {
            Frame main = pushFrame(MAIN);
            emit("program_start", new StepOrigin(sourceFile, 0, MAIN, main.frameId(), 0),
                    null, null, null, null);
        }

        void programEnd() {
            emit("program_end", mainOrigin(sourceFile), null, null, null, null);
        }

        void programOutput() {
            for (String line : stdout.split("\r?\n")) {
                if (!line.isEmpty()) {
                    emit("output", mainOrigin("stdout"), null, null, null, Map.of("text", line));
                }
            }
        }

        void accept(TraceEvent event) {
            if (isNoise(event)) {
                return;
            }
            switch (event.type()) {
                case FUNC_ENTER -> enterFunction(event);
                case FUNC_EXIT -> exitFunction(event);
                case LOOP_START -> loopStart(event);
                case LOOP_BODY_START -> loopBodyStart(event);
                case LOOP_ITERATION_END -> loopIterationEnd(event);
                case LOOP_CONDITION -> loopCondition(event);
                case LOOP_END -> loopEnd(event);
                default -> route(event);
            }
        }

        private void enterFunction(TraceEvent event) {
            String function = event.function();
            if (MAIN.equals(function) && !mainEntered && frames.size() == 1) {
                // program_start already stands for main's entry
                mainEntered = true;
                return;
            }
            Frame frame = pushFrame(function);
            emit("func_enter", origin(event), null, null, null, payload(event));
            log.trace("Entered {} as {}", function, frame.frameId());
        }

        private void exitFunction(TraceEvent event) {
            String function = event.function();
            if (frames.size() == 1 && MAIN.equals(function)) {
                // program_end stands for main's exit
                return;
            }
            int index = indexOfFrame(function);
            if (index < 1) {
                warnings.add(TraceWarning.of(TraceWarning.Kind.UNBALANCED_FRAME, event.sequence(),
                        "func_exit for " + function + " with no matching open frame"));
                log.warn("Dropping func_exit for {} (record {}): no matching frame", function, event.sequence());
                return;
            }
            while (frames.size() - 1 > index) {
                Frame skipped = frames.remove(frames.size() - 1);
                log.debug("Frame {} closed implicitly by exit of {}", skipped.frameId(), function);
            }
            emit("func_exit", origin(event), null, null, null, payload(event));
            frames.remove(frames.size() - 1);
        }

        private void loopStart(TraceEvent event) {
            StepOrigin origin = origin(event);
            emit("loop_start", origin, event.loopId(), event.loopType(), null, payload(event));
            loops.push(event.loopId(), event.loopType(), origin);
        }

        private void loopBodyStart(TraceEvent event) {
            if (!loops.isTop(event.loopId())) {
                mismatch(event);
                return;
            }
            int iteration = loops.peek().beginIteration();
            emit("loop_body_start", origin(event), event.loopId(), null, iteration, payload(event));
        }

        private void loopIterationEnd(TraceEvent event) {
            if (!loops.isTop(event.loopId())) {
                mismatch(event);
                return;
            }
            int iteration = loops.peek().iterationCounter();
            emit("loop_iteration_end", origin(event), event.loopId(), null, iteration, payload(event));
        }

        private void loopCondition(TraceEvent event) {
            if (!loops.isTop(event.loopId())) {
                mismatch(event);
                return;
            }
            emit("loop_condition", origin(event), event.loopId(), null, null, payload(event));
        }

        private void loopEnd(TraceEvent event) {
            if (!loops.isTop(event.loopId())) {
                mismatch(event);
                return;
            }
            flushSummary(loops.peek());
            loops.pop();
            emit("loop_end", origin(event), event.loopId(), null, null, payload(event));
        }

        private void mismatch(TraceEvent event) {
            LoopContext top = loops.peek();
            String message = event.type().wireName() + " for loop " + event.loopId()
                    + (top == null ? " with no active loop" : " while loop " + top.loopId() + " is on top");
            warnings.add(TraceWarning.loop(TraceWarning.Kind.MALFORMED_LOOP, event.sequence(), event.loopId(), message));
            log.warn("Malformed loop event at record {}: {}", event.sequence(), message);
            emit(event.type().wireName(), origin(event), event.loopId(), event.loopType(), null, payload(event));
        }

        /**
         * Structural events go straight out; everything else is buffered while a loop is active.
         */
        private void route(TraceEvent event) {
            String eventType = stepType(event);
            StepOrigin origin = origin(event);
            LoopContext top = loops.peek();
            if (top == null || event.type().isStructural()) {
                emit(eventType, origin, null, null, null, payload(event));
                return;
            }
            Integer iteration = top.iterationCounter() == 0 ? null : top.iterationCounter();
            top.append(new InternalEvent(top.bufferSize(), iteration, eventType, origin.file(), origin.line(),
                    origin.function(), origin.frameId(), payload(event)));
        }

        private void flushSummary(LoopContext context) {
            List<InternalEvent> buffered = context.buffer();
            if (buffered.isEmpty()) {
                return;
            }
            emit("loop_body_summary", context.origin(), context.loopId(), context.loopType(),
                    context.iterationCounter(), buffered, null);
        }

        void flushOpenLoops() {
            while (!loops.isEmpty()) {
                LoopContext parent = loops.parentOf(loops.depth() - 1);
                LoopContext orphan = loops.peek();
                String message = "Loop " + orphan.loopId()
                        + (parent == null ? "" : " (inside loop " + parent.loopId() + ")")
                        + " never ended after " + orphan.iterationCounter() + " iterations";
                warnings.add(TraceWarning.loop(TraceWarning.Kind.UNTERMINATED_LOOP, -1, orphan.loopId(), message));
                log.warn(message);
                flushSummary(orphan);
                loops.pop();
            }
        }

        private void emit(String eventType, StepOrigin origin, Integer loopId, String loopType,
                          Integer iteration, Map<String, Object> payload) {
            emit(eventType, origin, loopId, loopType, iteration, null, payload);
        }

        private void emit(String eventType, StepOrigin origin, Integer loopId, String loopType,
                          Integer iteration, List<InternalEvent> events, Map<String, Object> payload) {
            steps.add(new Step(steps.size(), eventType, clock.next(), origin.file(), origin.line(),
                    origin.function(), origin.frameId(), origin.callDepth(), loopId, loopType, iteration,
                    events, payload));
        }

        private Frame pushFrame(String function) {
            int count = frameCounts.merge(function, 1, Integer::sum) - 1;
            var frame = new Frame(function, function + "-" + count);
            frames.add(frame);
            return frame;
        }

        private int indexOfFrame(String function) {
            for (int i = frames.size() - 1; i >= 0; i--) {
                if (frames.get(i).function().equals(function)) {
                    return i;
                }
            }
            return -1;
        }

        private StepOrigin origin(TraceEvent event) {
            Frame frame = frames.get(frames.size() - 1);
            String file = event.file() == null ? sourceFile : baseName(event.file());
            return new StepOrigin(file, event.line(), frame.function(), frame.frameId(), frames.size() - 1);
        }

        private StepOrigin mainOrigin(String file) {
            Frame main = frames.get(0);
            return new StepOrigin(file, 0, main.function(), main.frameId(), 0);
        }

        private boolean isNoise(TraceEvent event) {
            String function = event.function();
            if (sourceFile != null && event.file() != null && sourceFile.equals(baseName(event.file()))) {
                return false;
            }
            if (function.startsWith("std::") || function.startsWith("__gnu_cxx::")) {
                return true;
            }
            return isLibraryHeader(event.file());
        }
    }

    /**
     * True for a file that is one of the iostream/locale library headers, or that sits
     * under a directory of that name. Matches path segments only, so {@code radios.cpp}
     * is not a header.
     */
    static boolean isLibraryHeader(String file) {
        if (file == null || file.isEmpty()) {
            return false;
        }
        String normalized = file.replace('\\', '/').toLowerCase(Locale.ROOT);
        for (String header : LIBRARY_HEADERS) {
            if (normalized.equals(header) || normalized.endsWith("/" + header)
                    || normalized.contains("/" + header + "/")) {
                return true;
            }
        }
        return false;
    }

    static String stepType(TraceEvent event) {
        return switch (event.type()) {
            case ASSIGN, VAR -> "var_assign";
            case DECLARE -> "var_declare";
            case CONTROL_FLOW -> {
                String control = event.stringAttribute("controlType");
                if ("break".equals(control)) {
                    yield "loop_break";
                }
                yield "continue".equals(control) ? "loop_continue" : "control_flow";
            }
            default -> event.type().wireName();
        };
    }

    /**
     * Kind-specific fields for the step. The runtime's own iteration count is per call frame
     * rather than per loop instance, so it is replaced by the engine's.
     */
    static Map<String, Object> payload(TraceEvent event) {
        var payload = new LinkedHashMap<String, Object>(event.attributes());
        payload.remove("iteration");
        payload.remove("loopType");
        return payload;
    }
}
