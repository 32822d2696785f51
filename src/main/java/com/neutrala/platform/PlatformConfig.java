package com.neutrala.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PlatformConfig {

    private static final Logger log = LoggerFactory.getLogger(PlatformConfig.class);

    @Bean
    public PlatformAdapter platformAdapter(TraceProperties traceProperties) {
        OsFamily family = OsFamily.current();
        log.info("Platform adapter initialised for {} (deterministic timestamps: {})",
                family, traceProperties.isDeterministic());
        return new PlatformAdapter(family, traceProperties.isDeterministic());
    }
}
