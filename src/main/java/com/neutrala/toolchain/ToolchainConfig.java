package com.neutrala.toolchain;

import com.neutrala.platform.PlatformAdapter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class ToolchainConfig {

    @Bean
    public ToolchainLayout toolchainLayout(ToolchainProperties properties, PlatformAdapter platformAdapter) {
        return new ToolchainLayout(Path.of(properties.getRoot()), platformAdapter.osFamily());
    }

    @Bean
    public ToolchainValidator toolchainValidator() {
        return new FilesystemToolchainValidator();
    }
}
