package com.neutrala.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 * Routes to subcommands: trace, convert, health.
 */
@Command(
        name = "neutrala",
        mixinStandardHelpOptions = true,
        version = "Neutrala tracer 0.1.0",
        description = "Traces C/C++ programs into step sequences for visualization",
        subcommands = {
                TraceCommand.class,
                ConvertCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class NeutralaCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
