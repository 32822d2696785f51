package com.neutrala.toolchain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Validates a toolchain by checking directory and binary presence on disk, then running
 * {@code clang++ --version}.
 */
public class FilesystemToolchainValidator implements ToolchainValidator {

    private static final Logger log = LoggerFactory.getLogger(FilesystemToolchainValidator.class);

    private static final int VERSION_TIMEOUT_SECONDS = 5;

    private final Function<Path, Optional<String>> versionCheck;

    public FilesystemToolchainValidator() {
        this(FilesystemToolchainValidator::queryVersion);
    }

    public FilesystemToolchainValidator(Function<Path, Optional<String>> versionCheck) {
        this.versionCheck = versionCheck;
    }

    @Override
    public ToolchainReport validate(ToolchainLayout layout) {
        var checks = new ArrayList<ToolchainCheck>();
        checks.add(directory("toolchain_root", layout.root()));
        checks.add(directory("platform_bin", layout.binDir()));
        checks.add(directory("platform_lib", layout.libDir()));
        checks.add(directory("headers", layout.headersDir()));

        Path clang = layout.binary("clang");
        Path clangxx = layout.binary("clang++");
        checks.add(new ToolchainCheck("clang", Files.isRegularFile(clang), clang.toString()));
        checks.add(new ToolchainCheck("clang++", Files.isRegularFile(clangxx), clangxx.toString()));

        if (Files.isRegularFile(clangxx)) {
            Optional<String> version = versionCheck.apply(clangxx);
            checks.add(new ToolchainCheck("clang_version_check", version.isPresent(),
                    version.map(v -> v.lines().findFirst().orElse(v)).orElse("no output from " + clangxx)));
        } else {
            checks.add(new ToolchainCheck("clang_version_check", false, "compiler not found"));
        }

        var report = new ToolchainReport(List.copyOf(checks));
        if (report.ok()) {
            log.debug("Toolchain at {} validated", layout.root());
        } else {
            log.warn("Toolchain at {} failed checks: {}", layout.root(),
                    report.failed().stream().map(ToolchainCheck::name).toList());
        }
        return report;
    }

    private static ToolchainCheck directory(String name, Path path) {
        return new ToolchainCheck(name, Files.isDirectory(path), path.toString());
    }

    static Optional<String> queryVersion(Path compiler) {
        try {
            Process process = new ProcessBuilder(compiler.toString(), "--version")
                    .redirectErrorStream(true)
                    .start();
            // version banners are a few hundred bytes, well inside the pipe buffer
            if (!process.waitFor(VERSION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return Optional.empty();
            }
            byte[] out = process.getInputStream().readAllBytes();
            String text = new String(out, StandardCharsets.UTF_8).trim();
            return process.exitValue() == 0 && !text.isEmpty() ? Optional.of(text) : Optional.empty();
        } catch (IOException e) {
            log.debug("Version check for {} failed: {}", compiler, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }
}
