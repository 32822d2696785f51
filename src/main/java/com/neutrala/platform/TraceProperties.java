package com.neutrala.platform;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "neutrala.trace")
public class TraceProperties {

    /**
     * When true, step timestamps are derived from a counter instead of the wall clock.
     * Bound from TRACE_DETERMINISTIC in application.yml.
     */
    private boolean deterministic = false;

    /** Root directory under which per-request session directories are allocated. */
    private String workDir = Path.of(System.getProperty("java.io.tmpdir"), "neutrala").toString();

    public boolean isDeterministic() { return deterministic; }
    public void setDeterministic(boolean deterministic) { this.deterministic = deterministic; }
    public String getWorkDir() { return workDir; }
    public void setWorkDir(String workDir) { this.workDir = workDir; }

    public Path workDirPath() {
        return Path.of(workDir);
    }
}
