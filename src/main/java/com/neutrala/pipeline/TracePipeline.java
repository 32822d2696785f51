package com.neutrala.pipeline;

import com.neutrala.compile.CompilationOrchestrator;
import com.neutrala.compile.CompileException;
import com.neutrala.compile.CompileResult;
import com.neutrala.core.logging.MdcContext;
import com.neutrala.core.metrics.TracerMetrics;
import com.neutrala.sandbox.ExecutionOptions;
import com.neutrala.sandbox.ExecutionResult;
import com.neutrala.sandbox.SandboxExecutor;
import com.neutrala.sandbox.SandboxProperties;
import com.neutrala.session.SessionAllocator;
import com.neutrala.session.SessionArtifacts;
import com.neutrala.steps.ConversionContext;
import com.neutrala.steps.ConversionResult;
import com.neutrala.steps.StepConversionEngine;
import com.neutrala.toolchain.ToolchainMissingException;
import com.neutrala.trace.ParsedTrace;
import com.neutrala.trace.TraceParser;
import com.neutrala.trace.TraceWarning;
import com.neutrala.trace.UnreadableTraceArtifactException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs one request end to end: allocate session, compile, execute, parse, convert.
 *
 * <p>Toolchain and compile failures abort the request by propagating their exception.
 * A run that timed out or overflowed its output cap still has its partial trace parsed.
 */
@Service
public class TracePipeline {

    private static final Logger log = LoggerFactory.getLogger(TracePipeline.class);

    private final SessionAllocator sessionAllocator;
    private final CompilationOrchestrator compiler;
    private final SandboxExecutor sandboxExecutor;
    private final TraceParser traceParser;
    private final StepConversionEngine conversionEngine;
    private final SandboxProperties sandboxProperties;
    private final TracerMetrics metrics;

    public TracePipeline(SessionAllocator sessionAllocator,
                         CompilationOrchestrator compiler,
                         SandboxExecutor sandboxExecutor,
                         TraceParser traceParser,
                         StepConversionEngine conversionEngine,
                         SandboxProperties sandboxProperties,
                         TracerMetrics metrics) {
        this.sessionAllocator = sessionAllocator;
        this.compiler = compiler;
        this.sandboxExecutor = sandboxExecutor;
        this.traceParser = traceParser;
        this.conversionEngine = conversionEngine;
        this.sandboxProperties = sandboxProperties;
        this.metrics = metrics;
    }

    public TraceRun run(TraceRequest request) {
        SessionArtifacts session = sessionAllocator.allocate(request.language().extension());
        String sessionId = session.sessionId();
        try {
            MdcContext.setStage(sessionId, "compile");
            log.info("Tracing {} program in session {}", request.language(), sessionId);
            CompileResult compiled = compile(session, request);

            MdcContext.setStage(sessionId, "execute");
            ExecutionOptions options = request.options() != null
                    ? request.options()
                    : sandboxProperties.toExecutionOptions();
            ExecutionResult execution = sandboxExecutor.execute(
                    compiled.executablePath(), session.traceOutput(), session.debugLog(), options);
            metrics.recordExecution(execution);

            MdcContext.setStage(sessionId, "parse");
            var warnings = new ArrayList<TraceWarning>();
            ParsedTrace trace = parseAfterRun(session.traceOutput(), execution);
            warnings.addAll(trace.warnings());

            MdcContext.setStage(sessionId, "convert");
            ConversionResult converted = conversionEngine.convertToSteps(trace.events(),
                    new ConversionContext(session.sourceFile().toString(), execution.stdout()));
            warnings.addAll(converted.warnings());

            metrics.recordSteps(converted.steps().size());
            metrics.recordWarnings(warnings);
            log.info("Session {} produced {} steps", sessionId, converted.steps().size());
            return new TraceRun(sessionId, converted.steps(), execution, warnings,
                    compiled.diagnostics(), trace.complete());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Parses and converts an existing trace artifact without compiling or running anything.
     */
    public ConversionResult convertArtifact(Path artifact, String sourceFile, String stdout) {
        ParsedTrace trace = traceParser.parse(artifact);
        ConversionResult converted = conversionEngine.convertToSteps(trace.events(),
                new ConversionContext(sourceFile, stdout));
        var warnings = new ArrayList<TraceWarning>(trace.warnings());
        warnings.addAll(converted.warnings());
        metrics.recordSteps(converted.steps().size());
        metrics.recordWarnings(warnings);
        return new ConversionResult(converted.steps(), warnings);
    }

    private CompileResult compile(SessionArtifacts session, TraceRequest request) {
        long started = System.currentTimeMillis();
        String language = request.language().name().toLowerCase(Locale.ROOT);
        try {
            CompileResult result = compiler.compile(session, request.sourceText(), request.language(), request.flags());
            metrics.recordCompile(language, true, System.currentTimeMillis() - started);
            return result;
        } catch (ToolchainMissingException e) {
            metrics.recordRequestFailure("toolchain_missing");
            log.error("Toolchain incomplete: {}", e.getMessage());
            throw e;
        } catch (CompileException e) {
            metrics.recordCompile(language, false, System.currentTimeMillis() - started);
            metrics.recordRequestFailure("compile_error");
            throw e;
        }
    }

    /**
     * A run that was cut short may not have created the artifact at all; that yields no events
     * rather than a failure.
     */
    private ParsedTrace parseAfterRun(Path traceOutput, ExecutionResult execution) {
        if (!Files.exists(traceOutput) && execution.haltedEarly()) {
            String reason = execution.timedOut() ? "timed out" : "exceeded its output cap";
            log.warn("Program {} before writing a trace artifact", reason);
            return ParsedTrace.empty(List.of(TraceWarning.of(TraceWarning.Kind.INCOMPLETE_ARTIFACT, -1,
                    "Program " + reason + " before writing a trace artifact")));
        }
        try {
            return traceParser.parse(traceOutput);
        } catch (UnreadableTraceArtifactException e) {
            metrics.recordRequestFailure("unreadable_trace");
            throw e;
        }
    }
}
