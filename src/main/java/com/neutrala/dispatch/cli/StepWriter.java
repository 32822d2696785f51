package com.neutrala.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes command results as pretty-printed JSON to a file, or to stdout when no file is given.
 */
final class StepWriter {

    private StepWriter() {}

    static void write(ObjectMapper objectMapper, Object value, Path output) throws IOException {
        var writer = objectMapper.writerWithDefaultPrettyPrinter();
        if (output == null) {
            System.out.println(writer.writeValueAsString(value));
            return;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        writer.writeValue(output.toFile(), value);
        ConsoleOutput.success("Steps written to " + output);
    }
}
