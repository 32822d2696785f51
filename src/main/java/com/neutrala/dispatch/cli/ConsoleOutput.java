package com.neutrala.dispatch.cli;

import com.neutrala.sandbox.ExecutionResult;
import com.neutrala.trace.TraceWarning;
import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the tracer CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) NEUTRALA TRACER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [NEUTRALA]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void execution(ExecutionResult result) {
        String status = result.signal() != null
                ? "@|fg(red) signal " + result.signal() + "|@"
                : (result.exitedCleanly() ? "@|fg(green) exit 0|@" : "@|fg(red) exit " + result.exitCode() + "|@");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [SANDBOX]|@ " + status + " in " + result.elapsedMs() + "ms via " + result.executor()));
        if (result.timedOut()) {
            warn("Execution timed out, trace may be partial");
        }
        if (result.truncated()) {
            warn("Output exceeded the cap and was truncated, trace may be partial");
        }
    }

    public static void programOutput(String stdout) {
        if (stdout == null || stdout.isEmpty()) {
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Program output|@"));
        for (String line : stdout.split("\r?\n")) {
            System.out.println("  " + line);
        }
    }

    public static void warnings(List<TraceWarning> warnings) {
        for (TraceWarning warning : warnings) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) [" + warning.kind() + "]|@ " + warning.message()));
        }
    }

    public static void diagnostics(String text) {
        for (String line : text.split("\r?\n")) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(red) |@" + line));
        }
    }
}
