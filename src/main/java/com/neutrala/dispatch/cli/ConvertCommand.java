package com.neutrala.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.neutrala.core.TracerException;
import com.neutrala.pipeline.TracePipeline;
import com.neutrala.steps.ConversionResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: neutrala convert &lt;trace-artifact&gt;
 * <p>
 * Re-runs parsing and step conversion on an existing trace artifact. With
 * TRACE_DETERMINISTIC=true the output is byte-for-byte reproducible.
 */
@Command(name = "convert", mixinStandardHelpOptions = true,
        description = "Convert an existing trace artifact into steps")
@Component
public class ConvertCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Trace artifact written by an instrumented program")
    private Path artifact;

    @Option(names = "--source", description = "Name of the traced source file", defaultValue = "main.cpp")
    private String sourceFile;

    @Option(names = "--stdout", description = "File holding the program's captured stdout")
    private Path stdoutFile;

    @Option(names = {"--output", "-o"}, description = "Write steps JSON to this file instead of stdout")
    private Path output;

    private final TracePipeline pipeline;
    private final ObjectMapper objectMapper;

    public ConvertCommand(TracePipeline pipeline, ObjectMapper objectMapper) {
        this.pipeline = pipeline;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        String stdout = "";
        if (stdoutFile != null) {
            try {
                stdout = Files.readString(stdoutFile, StandardCharsets.UTF_8);
            } catch (IOException e) {
                ConsoleOutput.error("Cannot read " + stdoutFile + ": " + e.getMessage());
                return ExitCodes.FAILURE;
            }
        }

        ConversionResult result;
        try {
            result = pipeline.convertArtifact(artifact, sourceFile, stdout);
        } catch (TracerException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.FAILURE;
        }

        if (output != null) {
            ConsoleOutput.success(result.steps().size() + " steps from " + artifact.getFileName());
            if (!result.warnings().isEmpty()) {
                ConsoleOutput.warn(result.warnings().size() + " trace warnings");
                ConsoleOutput.warnings(result.warnings());
            }
        }
        try {
            StepWriter.write(objectMapper, result, output);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot write " + output + ": " + e.getMessage());
            return ExitCodes.FAILURE;
        }
        return ExitCodes.OK;
    }
}
