package com.neutrala.compile;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CompileConfig {

    private static final long TOOL_TIMEOUT_SECONDS = 60;

    @Bean
    public ToolInvoker toolInvoker() {
        return new ProcessToolInvoker(TOOL_TIMEOUT_SECONDS);
    }
}
