package com.neutrala.toolchain;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "neutrala.toolchain")
public class ToolchainProperties {

    private String root = "resources/toolchain";

    /**
     * Source file of the instrumentation runtime (the {@code __cyg_profile_func_*} hooks and
     * trace writer). When set it is compiled once per request and linked into the program.
     */
    private String tracerRuntime;

    private String cStandard = "c11";
    private String cppStandard = "c++17";

    public String getRoot() { return root; }
    public void setRoot(String root) { this.root = root; }
    public String getTracerRuntime() { return tracerRuntime; }
    public void setTracerRuntime(String tracerRuntime) { this.tracerRuntime = tracerRuntime; }
    public String getCStandard() { return cStandard; }
    public void setCStandard(String cStandard) { this.cStandard = cStandard; }
    public String getCppStandard() { return cppStandard; }
    public void setCppStandard(String cppStandard) { this.cppStandard = cppStandard; }

    public boolean hasTracerRuntime() {
        return tracerRuntime != null && !tracerRuntime.isBlank();
    }
}
