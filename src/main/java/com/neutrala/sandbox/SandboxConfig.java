package com.neutrala.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.neutrala.platform.OsFamily;
import com.neutrala.platform.PlatformAdapter;
import com.neutrala.toolchain.ToolchainLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the {@link SandboxExecutor} once at startup by probing the platform, so the
 * execution path never branches on capability.
 */
@Configuration
public class SandboxConfig {

    private static final Logger log = LoggerFactory.getLogger(SandboxConfig.class);

    @Bean
    public SandboxExecutor sandboxExecutor(SandboxProperties properties,
                                           PlatformAdapter platformAdapter,
                                           ToolchainLayout toolchainLayout,
                                           ObjectMapper objectMapper) {
        Map<String, String> env = System.getenv();
        var supervisor = new ProcessSupervisor(platformAdapter, toolchainLayout::libraryDirs, env, objectMapper);
        Optional<Path> prlimit = ResourceLimitedSandboxExecutor.locatePrlimit(platformAdapter.osFamily(), env);
        return select(properties.getLimits(), platformAdapter.osFamily(), prlimit, supervisor);
    }

    static SandboxExecutor select(SandboxProperties.LimitMode mode, OsFamily osFamily,
                                  Optional<Path> prlimit, ProcessSupervisor supervisor) {
        switch (mode) {
            case SOFT -> {
                log.info("Sandbox: soft limits (configured)");
                return new SoftLimitSandboxExecutor(supervisor);
            }
            case HARD, AUTO -> {
                if (prlimit.isPresent()) {
                    log.info("Sandbox: OS-enforced limits via {}", prlimit.get());
                    return new ResourceLimitedSandboxExecutor(supervisor, prlimit.get());
                }
                if (mode == SandboxProperties.LimitMode.HARD) {
                    log.warn("Hard limits requested but prlimit is not available on {}; using soft limits", osFamily);
                } else {
                    log.info("Sandbox: soft limits (no OS limit facility on {})", osFamily);
                }
                return new SoftLimitSandboxExecutor(supervisor);
            }
            default -> throw new IllegalStateException("Unknown limit mode " + mode);
        }
    }
}
