package com.neutrala.compile;

import com.neutrala.platform.OsFamily;
import com.neutrala.platform.PlatformAdapter;
import com.neutrala.session.SessionArtifacts;
import com.neutrala.toolchain.ToolchainCheck;
import com.neutrala.toolchain.ToolchainLayout;
import com.neutrala.toolchain.ToolchainMissingException;
import com.neutrala.toolchain.ToolchainProperties;
import com.neutrala.toolchain.ToolchainReport;
import com.neutrala.toolchain.ToolchainValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompilationOrchestratorTest {

    @TempDir
    Path tempDir;

    private ToolchainLayout layout;
    private ToolchainProperties properties;
    private SessionArtifacts session;
    private final List<List<String>> invocations = new ArrayList<>();
    private final PlatformAdapter adapter = new PlatformAdapter(OsFamily.LINUX, false);
    private final ToolchainValidator alwaysValid = l -> new ToolchainReport(List.of());

    @BeforeEach
    void setUp() throws IOException {
        layout = new ToolchainLayout(tempDir.resolve("toolchain"), OsFamily.LINUX);
        properties = new ToolchainProperties();
        Path sessionDir = Files.createDirectories(tempDir.resolve("session"));
        session = SessionArtifacts.in(sessionDir, "s1", "c", "exec_s1");
    }

    private CompilationOrchestrator orchestrator(ToolchainValidator validator, ToolInvoker invoker) {
        return new CompilationOrchestrator(adapter, layout, properties, validator, invoker);
    }

    private ToolInvoker recording(ToolInvoker.ToolResult result) {
        return (command, workDir) -> {
            invocations.add(command);
            return result;
        };
    }

    @Test
    @DisplayName("C program compiles then links with the C driver")
    void compilesAndLinksC() throws IOException {
        var result = orchestrator(alwaysValid, recording(new ToolInvoker.ToolResult(0, "")))
                .compile(session, "int main(void){return 0;}", Language.C, List.of("-O3", "-Wall"));

        assertEquals(session.executable(), result.executablePath());
        assertEquals("int main(void){return 0;}", Files.readString(session.sourceFile()));
        assertEquals(2, invocations.size());

        List<String> compile = invocations.get(0);
        assertEquals(layout.binary("clang").toString(), compile.get(0));
        assertEquals(PlatformAdapter.REQUIRED_FLAGS, compile.subList(1, 5));
        assertTrue(compile.contains("-std=c11"));
        assertTrue(compile.contains("-Wall"));
        assertFalse(compile.contains("-O3"));
        assertEquals(List.of("-c", session.sourceFile().toString(), "-o", session.objectFile().toString()),
                compile.subList(compile.size() - 4, compile.size()));

        List<String> link = invocations.get(1);
        assertEquals(layout.binary("clang").toString(), link.get(0));
        assertTrue(link.containsAll(List.of("-pthread", "-ldl", session.objectFile().toString())));
        int out = link.indexOf("-o");
        assertEquals(session.executable().toString(), link.get(out + 1));
    }

    @Test
    @DisplayName("Tracer runtime is compiled separately and linked with the C++ driver")
    void runtimeLinkedWithCppDriver() {
        properties.setTracerRuntime(tempDir.resolve("tracer.cpp").toString());

        orchestrator(alwaysValid, recording(new ToolInvoker.ToolResult(0, "")))
                .compile(session, "int main(){}", Language.C, List.of());

        assertEquals(3, invocations.size());
        List<String> runtime = invocations.get(1);
        assertEquals(layout.binary("clang++").toString(), runtime.get(0));
        assertFalse(runtime.contains("-finstrument-functions"));
        assertTrue(runtime.contains(session.runtimeObjectFile().toString()));

        List<String> link = invocations.get(2);
        assertEquals(layout.binary("clang++").toString(), link.get(0));
        assertTrue(link.contains(session.runtimeObjectFile().toString()));
    }

    @Test
    @DisplayName("Compile error carries the compiler's diagnostics and leaves no executable")
    void compileErrorHasDiagnostics() throws IOException {
        Files.writeString(session.executable(), "stale");
        String diagnostics = "clang: error: unknown argument: '-fbogus-flag'\n";

        var ex = assertThrows(CompileException.class, () ->
                orchestrator(alwaysValid, recording(new ToolInvoker.ToolResult(1, diagnostics)))
                        .compile(session, "int main(){}", Language.CPP, List.of("-fbogus-flag")));

        assertEquals(diagnostics, ex.getDiagnostics());
        assertEquals("User compile", ex.getStage());
        assertEquals(1, invocations.size(), "linking must not run after a failed compile");
        assertFalse(Files.exists(session.executable()));
    }

    @Test
    @DisplayName("Link failure removes the object files written by earlier stages")
    void linkFailureRemovesObjects() {
        properties.setTracerRuntime(tempDir.resolve("tracer.cpp").toString());
        ToolInvoker linkFails = (command, workDir) -> {
            invocations.add(command);
            String target = command.get(command.indexOf("-o") + 1);
            if (target.equals(session.executable().toString())) {
                return new ToolInvoker.ToolResult(1, "ld: undefined reference to `__cyg_profile_func_enter'\n");
            }
            try {
                Files.writeString(Path.of(target), "object");
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            return new ToolInvoker.ToolResult(0, "");
        };

        var ex = assertThrows(CompileException.class, () ->
                orchestrator(alwaysValid, linkFails).compile(session, "int main(){}", Language.C, List.of()));

        assertEquals("Linking", ex.getStage());
        assertEquals(3, invocations.size());
        assertFalse(Files.exists(session.objectFile()));
        assertFalse(Files.exists(session.runtimeObjectFile()));
        assertFalse(Files.exists(session.executable()));
        assertTrue(Files.exists(session.sourceFile()));
    }

    @Test
    @DisplayName("Warnings from successful stages are returned as diagnostics")
    void warningsReturned() {
        var result = orchestrator(alwaysValid,
                recording(new ToolInvoker.ToolResult(0, "warning: unused variable 'x'\n")))
                .compile(session, "int main(){int x;}", Language.C, List.of());

        assertTrue(result.diagnostics().contains("unused variable"));
    }

    @Test
    @DisplayName("Missing toolchain fails before any tool runs")
    void missingToolchain() {
        ToolchainValidator missing = l -> new ToolchainReport(
                List.of(new ToolchainCheck("clang++", false, "/nowhere/clang++")));

        var ex = assertThrows(ToolchainMissingException.class, () ->
                orchestrator(missing, recording(new ToolInvoker.ToolResult(0, "")))
                        .compile(session, "int main(){}", Language.CPP, List.of()));

        assertEquals("clang++", ex.getFailedChecks().get(0).name());
        assertTrue(invocations.isEmpty());
    }
}
