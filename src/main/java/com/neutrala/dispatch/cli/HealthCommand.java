package com.neutrala.dispatch.cli;

import com.neutrala.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: neutrala health
 * <p>
 * Checks the toolchain, the sandbox executor and the session directory
 * and displays results with colored output.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check tracer health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        var checks = healthCheckService.checkAll();
        boolean allUp = true;

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    allUp = false;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: ready to trace");
            return ExitCodes.OK;
        }
        ConsoleOutput.error("Overall: one or more components degraded or down");
        return ExitCodes.FAILURE;
    }
}
