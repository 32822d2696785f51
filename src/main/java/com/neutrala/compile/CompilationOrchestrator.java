package com.neutrala.compile;

import com.neutrala.core.TracerException;
import com.neutrala.platform.PlatformAdapter;
import com.neutrala.session.SessionArtifacts;
import com.neutrala.toolchain.ToolchainLayout;
import com.neutrala.toolchain.ToolchainProperties;
import com.neutrala.toolchain.ToolchainValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Produces an instrumented executable from source text.
 *
 * <p>Flow: validate toolchain -> write source -> compile user object (instrumented) ->
 * compile tracer runtime object (not instrumented, optional) -> link.
 * Any failing stage raises {@link CompileException} and leaves no executable behind.
 */
@Service
public class CompilationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CompilationOrchestrator.class);

    private final PlatformAdapter platformAdapter;
    private final ToolchainLayout layout;
    private final ToolchainProperties toolchainProperties;
    private final ToolchainValidator validator;
    private final ToolInvoker toolInvoker;

    public CompilationOrchestrator(PlatformAdapter platformAdapter,
                                   ToolchainLayout layout,
                                   ToolchainProperties toolchainProperties,
                                   ToolchainValidator validator,
                                   ToolInvoker toolInvoker) {
        this.platformAdapter = platformAdapter;
        this.layout = layout;
        this.toolchainProperties = toolchainProperties;
        this.validator = validator;
        this.toolInvoker = toolInvoker;
    }

    /**
     * Compiles {@code sourceText} into {@link SessionArtifacts#executable()}.
     *
     * @param userFlags extra flags from the caller; conflicting ones are dropped
     * @throws com.neutrala.toolchain.ToolchainMissingException if the toolchain is incomplete
     * @throws CompileException if any toolchain stage exits non-zero
     */
    public CompileResult compile(SessionArtifacts session, String sourceText, Language language, List<String> userFlags) {
        validator.requireValid(layout);

        try {
            Files.writeString(session.sourceFile(), sourceText, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TracerException("Could not write source file " + session.sourceFile(), e);
        }

        var diagnostics = new StringBuilder();
        boolean withRuntime = toolchainProperties.hasTracerRuntime();

        var userCompile = new ArrayList<String>();
        userCompile.add(layout.binary(language.driver()).toString());
        userCompile.addAll(platformAdapter.normalizeFlags(userCompileFlags(language, userFlags)));
        // debug info records this spelling, and trace records carry it as their file
        String sourcePath = platformAdapter.normalizePath(session.sourceFile().toString());
        userCompile.addAll(List.of("-c", sourcePath, "-o", session.objectFile().toString()));
        runStage("User compile", userCompile, session, diagnostics);

        if (withRuntime) {
            var runtimeCompile = new ArrayList<String>();
            runtimeCompile.add(layout.binary(Language.CPP.driver()).toString());
            runtimeCompile.addAll(List.of("-c", "-g", "-O0", "-std=" + toolchainProperties.getCppStandard(),
                    "-fno-omit-frame-pointer", "-fno-inline"));
            runtimeCompile.addAll(layout.includeFlags());
            runtimeCompile.addAll(List.of(Path.of(toolchainProperties.getTracerRuntime()).toAbsolutePath().toString(),
                    "-o", session.runtimeObjectFile().toString()));
            runStage("Tracer runtime compile", runtimeCompile, session, diagnostics);
        }

        // the runtime is C++, so linking it needs the C++ driver even for C programs
        Language linkDriver = withRuntime ? Language.CPP : language;
        var link = new ArrayList<String>();
        link.add(layout.binary(linkDriver.driver()).toString());
        if (platformAdapter.osFamily().isPosix()) {
            link.addAll(List.of("-pthread", "-ldl"));
        }
        link.add(session.objectFile().toString());
        if (withRuntime) {
            link.add(session.runtimeObjectFile().toString());
        }
        link.addAll(List.of("-o", session.executable().toString()));
        link.addAll(layout.linkerFlags());
        runStage("Linking", link, session, diagnostics);

        log.info("Compiled session {} ({}) -> {}", session.sessionId(), language, session.executable());
        return new CompileResult(session.executable(), diagnostics.toString());
    }

    private List<String> userCompileFlags(Language language, List<String> userFlags) {
        var flags = new ArrayList<String>();
        flags.add("-std=" + (language == Language.CPP
                ? toolchainProperties.getCppStandard()
                : toolchainProperties.getCStandard()));
        flags.addAll(layout.includeFlags());
        flags.add("-fno-inline");
        if (userFlags != null) {
            flags.addAll(userFlags);
        }
        return flags;
    }

    private void runStage(String stage, List<String> command, SessionArtifacts session, StringBuilder diagnostics) {
        log.debug("{} command: {}", stage, String.join(" ", command));
        ToolInvoker.ToolResult result = toolInvoker.run(command, session.directory());
        if (!result.succeeded()) {
            deleteQuietly(session.objectFile());
            deleteQuietly(session.runtimeObjectFile());
            deleteQuietly(session.executable());
            log.info("{} failed for session {} (exit {})", stage, session.sessionId(), result.exitCode());
            throw new CompileException(stage, result.output());
        }
        if (!result.output().isBlank()) {
            diagnostics.append(result.output());
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove partial artifact {}: {}", path, e.getMessage());
        }
    }
}
