package com.neutrala.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.neutrala.compile.CompileException;
import com.neutrala.compile.Language;
import com.neutrala.core.TracerException;
import com.neutrala.pipeline.TracePipeline;
import com.neutrala.pipeline.TraceRequest;
import com.neutrala.pipeline.TraceRun;
import com.neutrala.sandbox.SandboxProperties;
import com.neutrala.toolchain.ToolchainCheck;
import com.neutrala.toolchain.ToolchainMissingException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: neutrala trace &lt;source&gt;
 * <p>
 * Compiles the program with instrumentation, runs it under the configured limits and
 * writes the resulting step sequence as JSON.
 */
@Command(name = "trace", mixinStandardHelpOptions = true, description = "Compile, run and trace a C/C++ program")
@Component
public class TraceCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "C or C++ source file")
    private Path source;

    @Option(names = {"--language", "-l"}, description = "c or cpp (default: from the file extension)")
    private String language;

    @Option(names = {"--flag", "-f"}, description = "Extra compiler flag, repeatable (use --flag=-DX=1)")
    private List<String> flags = new ArrayList<>();

    @Option(names = "--time-ms", description = "Execution timeout in milliseconds")
    private Long timeMs;

    @Option(names = {"--output", "-o"}, description = "Write steps JSON to this file instead of stdout")
    private Path output;

    private final TracePipeline pipeline;
    private final SandboxProperties sandboxProperties;
    private final ObjectMapper objectMapper;

    public TraceCommand(TracePipeline pipeline, SandboxProperties sandboxProperties, ObjectMapper objectMapper) {
        this.pipeline = pipeline;
        this.sandboxProperties = sandboxProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        // without --output stdout carries only the steps JSON
        boolean status = output != null;
        if (status) {
            ConsoleOutput.printBanner();
        }

        Language lang;
        try {
            lang = language != null ? Language.fromName(language) : languageOf(source);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.FAILURE;
        }

        String sourceText;
        try {
            sourceText = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + source + ": " + e.getMessage());
            return ExitCodes.FAILURE;
        }

        var options = timeMs == null ? null : sandboxProperties.toExecutionOptions().withTimeMs(timeMs);
        if (status) {
            ConsoleOutput.info("Tracing " + source.getFileName() + " as " + lang);
        }

        TraceRun run;
        try {
            run = pipeline.run(new TraceRequest(sourceText, lang, flags, options));
        } catch (ToolchainMissingException e) {
            ConsoleOutput.error("Toolchain incomplete: " + e.getFailedChecks().stream()
                    .map(ToolchainCheck::name).collect(Collectors.joining(", ")));
            return ExitCodes.TOOLCHAIN_MISSING;
        } catch (CompileException e) {
            ConsoleOutput.error(e.getStage() + " failed");
            ConsoleOutput.diagnostics(e.getDiagnostics());
            return ExitCodes.COMPILE_ERROR;
        } catch (TracerException e) {
            ConsoleOutput.error("Trace failed: " + e.getMessage());
            return ExitCodes.FAILURE;
        }

        if (status) {
            ConsoleOutput.execution(run.execution());
            ConsoleOutput.programOutput(run.execution().stdout());
            ConsoleOutput.success(run.steps().size() + " steps, session " + run.sessionId());
            if (!run.warnings().isEmpty()) {
                ConsoleOutput.warn(run.warnings().size() + " trace warnings");
                ConsoleOutput.warnings(run.warnings());
            }
        }

        try {
            StepWriter.write(objectMapper, run, output);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot write " + output + ": " + e.getMessage());
            return ExitCodes.FAILURE;
        }
        return ExitCodes.OK;
    }

    static Language languageOf(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            throw new IllegalArgumentException("Cannot infer language of " + name + ", pass --language");
        }
        return Language.fromName(name.substring(dot + 1));
    }
}
