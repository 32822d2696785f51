package com.neutrala.session;

import java.nio.file.Path;

/**
 * File locations for one compile/execute/parse cycle. The core only reads and writes these
 * paths; creating and sweeping the session directory belongs to the session lifecycle.
 *
 * @param sessionId         request-scoped identifier
 * @param directory         session directory every other path lives in
 * @param sourceFile        user program written by the compiler stage
 * @param objectFile        instrumented object of the user program
 * @param runtimeObjectFile object of the tracer runtime, when one is linked
 * @param executable        linked program
 * @param traceOutput       trace artifact the program writes (its {@code TRACE_OUTPUT})
 * @param debugLog          crash diagnostics written by the executor
 */
public record SessionArtifacts(
        String sessionId,
        Path directory,
        Path sourceFile,
        Path objectFile,
        Path runtimeObjectFile,
        Path executable,
        Path traceOutput,
        Path debugLog
) {

    public static SessionArtifacts in(Path directory, String sessionId, String sourceExtension, String executableName) {
        Path dir = directory.toAbsolutePath().normalize();
        return new SessionArtifacts(
                sessionId,
                dir,
                dir.resolve("src_" + sessionId + "." + sourceExtension),
                dir.resolve("src_" + sessionId + ".o"),
                dir.resolve("tracer_" + sessionId + ".o"),
                dir.resolve(executableName),
                dir.resolve("trace_" + sessionId + ".json"),
                dir.resolve("trace_debug_" + sessionId + ".json")
        );
    }
}
