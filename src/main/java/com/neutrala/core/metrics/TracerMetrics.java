package com.neutrala.core.metrics;

import com.neutrala.sandbox.ExecutionResult;
import com.neutrala.trace.TraceWarning;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for the trace pipeline.
 */
@Service
public class TracerMetrics {

    private final MeterRegistry registry;

    public TracerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCompile(String language, boolean success, long ms) {
        Timer.builder("neutrala.compile.duration")
                .tag("language", language)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records one sandboxed run: its duration and, when it was cut short, why.
     */
    public void recordExecution(ExecutionResult result) {
        Timer.builder("neutrala.execution.duration")
                .tag("executor", result.executor())
                .register(registry)
                .record(Duration.ofMillis(result.elapsedMs()));

        String outcome;
        if (result.timedOut()) {
            outcome = "timeout";
        } else if (result.truncated()) {
            outcome = "truncated";
        } else if (result.signal() != null) {
            outcome = "signal";
        } else {
            outcome = result.exitedCleanly() ? "success" : "nonzero";
        }
        Counter.builder("neutrala.executions.total")
                .description("Sandboxed executions by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordSteps(int count) {
        DistributionSummary.builder("neutrala.steps.emitted")
                .description("Steps emitted per conversion")
                .register(registry)
                .record(count);
    }

    public void recordWarnings(List<TraceWarning> warnings) {
        for (TraceWarning warning : warnings) {
            Counter.builder("neutrala.trace.warnings")
                    .tag("kind", warning.kind().name().toLowerCase(Locale.ROOT))
                    .register(registry)
                    .increment();
        }
    }

    public void recordRequestFailure(String reason) {
        Counter.builder("neutrala.requests.failed")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
