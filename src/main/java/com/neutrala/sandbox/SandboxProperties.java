package com.neutrala.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "neutrala")
public class SandboxProperties {

    private Sandbox sandbox = new Sandbox();

    // -- Sandbox accessors (delegate to nested) --
    public long getTimeMs() { return sandbox.timeMs; }
    public long getMaxOutputBytes() { return sandbox.maxOutputBytes; }
    public long getMemoryBytes() { return sandbox.memoryBytes; }
    public long getCpuSeconds() { return sandbox.cpuSeconds; }
    public LimitMode getLimits() { return sandbox.limits; }

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }

    /**
     * Which executor to use. {@code AUTO} picks OS-enforced limits when the host supports them.
     */
    public enum LimitMode { AUTO, SOFT, HARD }

    public ExecutionOptions toExecutionOptions() {
        return new ExecutionOptions(sandbox.timeMs, sandbox.maxOutputBytes, sandbox.memoryBytes, sandbox.cpuSeconds);
    }

    public static class Sandbox {
        private long timeMs = 2000;
        private long maxOutputBytes = 1024 * 1024;
        /** Address-space ceiling in bytes; 0 leaves it unset. */
        private long memoryBytes = 0;
        /** CPU-time ceiling in seconds; 0 leaves it unset. */
        private long cpuSeconds = 0;
        private LimitMode limits = LimitMode.AUTO;

        public long getTimeMs() { return timeMs; }
        public void setTimeMs(long timeMs) { this.timeMs = timeMs; }
        public long getMaxOutputBytes() { return maxOutputBytes; }
        public void setMaxOutputBytes(long maxOutputBytes) { this.maxOutputBytes = maxOutputBytes; }
        public long getMemoryBytes() { return memoryBytes; }
        public void setMemoryBytes(long memoryBytes) { this.memoryBytes = memoryBytes; }
        public long getCpuSeconds() { return cpuSeconds; }
        public void setCpuSeconds(long cpuSeconds) { this.cpuSeconds = cpuSeconds; }
        public LimitMode getLimits() { return limits; }
        public void setLimits(LimitMode limits) { this.limits = limits; }
    }
}
