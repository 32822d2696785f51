package com.neutrala.core.health;

import com.neutrala.platform.TraceProperties;
import com.neutrala.sandbox.ResourceLimitedSandboxExecutor;
import com.neutrala.sandbox.SandboxExecutor;
import com.neutrala.sandbox.SandboxProperties;
import com.neutrala.toolchain.ToolchainCheck;
import com.neutrala.toolchain.ToolchainLayout;
import com.neutrala.toolchain.ToolchainReport;
import com.neutrala.toolchain.ToolchainValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ToolchainValidator toolchainValidator;
    private final ToolchainLayout toolchainLayout;
    private final SandboxExecutor sandboxExecutor;
    private final SandboxProperties sandboxProperties;
    private final TraceProperties traceProperties;

    public HealthCheckService(ToolchainValidator toolchainValidator,
                              ToolchainLayout toolchainLayout,
                              SandboxExecutor sandboxExecutor,
                              SandboxProperties sandboxProperties,
                              TraceProperties traceProperties) {
        this.toolchainValidator = toolchainValidator;
        this.toolchainLayout = toolchainLayout;
        this.sandboxExecutor = sandboxExecutor;
        this.sandboxProperties = sandboxProperties;
        this.traceProperties = traceProperties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkToolchain());
        results.add(checkSandbox());
        results.add(checkWorkDir());
        return results;
    }

    private HealthStatus checkToolchain() {
        ToolchainReport report = toolchainValidator.validate(toolchainLayout);
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("root", toolchainLayout.root().toString());
        for (ToolchainCheck check : report.checks()) {
            metadata.put(check.name(), check.ok() ? "ok" : check.detail());
        }
        if (report.ok()) {
            return new HealthStatus("toolchain", HealthStatus.Status.UP,
                    "All toolchain checks passed", metadata);
        }
        String failed = report.failed().stream().map(ToolchainCheck::name).collect(Collectors.joining(", "));
        return new HealthStatus("toolchain", HealthStatus.Status.DOWN,
                "Missing: " + failed, metadata);
    }

    private HealthStatus checkSandbox() {
        Map<String, String> metadata = Map.of(
                "executor", sandboxExecutor.name(),
                "timeMs", String.valueOf(sandboxProperties.getTimeMs()),
                "maxOutputBytes", String.valueOf(sandboxProperties.getMaxOutputBytes()));
        boolean hardRequested = sandboxProperties.getLimits() == SandboxProperties.LimitMode.HARD;
        if (hardRequested && !ResourceLimitedSandboxExecutor.NAME.equals(sandboxExecutor.name())) {
            return new HealthStatus("sandbox", HealthStatus.Status.DEGRADED,
                    "Hard limits requested but unavailable, running with soft limits", metadata);
        }
        return new HealthStatus("sandbox", HealthStatus.Status.UP,
                "Executor " + sandboxExecutor.name() + " available", metadata);
    }

    private HealthStatus checkWorkDir() {
        Path workDir = traceProperties.workDirPath();
        try {
            Files.createDirectories(workDir);
            if (Files.isWritable(workDir)) {
                return new HealthStatus("workdir", HealthStatus.Status.UP,
                        "Session directory writable", Map.of("path", workDir.toString()));
            }
            return new HealthStatus("workdir", HealthStatus.Status.DOWN,
                    "Session directory not writable", Map.of("path", workDir.toString()));
        } catch (IOException e) {
            log.warn("Work directory health check failed: {}", e.getMessage());
            return new HealthStatus("workdir", HealthStatus.Status.DOWN,
                    "Cannot create session directory: " + e.getMessage(), Map.of("path", workDir.toString()));
        }
    }
}
