package com.gantry.dispatch.cli;

import com.gantry.core.health.HealthCheckService;
import com.gantry.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: gantry health
 * <p>
 * Prints each component with its detail lines. Exits 0 when everything is up,
 * 1 when something is degraded and 2 when a component is down, so scripts can
 * gate on it the same way a load balancer gates on the HTTP status.
 */
@Command(name = "health", mixinStandardHelpOptions = true,
        description = "Check the state store, executors and degradation level")
@Component
public class HealthCommand implements Callable<Integer> {

    static final int EXIT_DEGRADED = 1;
    static final int EXIT_DOWN = 2;

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.info(label);
                case DOWN -> ConsoleOutput.error(label);
            }
            check.metadata().forEach((key, value) -> System.out.println("    " + key + ": " + value));
        }

        System.out.println("──────────────────────────────────");
        HealthStatus.Status overall = HealthStatus.overall(checks);
        switch (overall) {
            case UP -> ConsoleOutput.success("Overall: all systems operational");
            case DEGRADED -> ConsoleOutput.info("Overall: degraded, dispatch may be throttled");
            case DOWN -> ConsoleOutput.error("Overall: one or more components down");
        }
        return switch (overall) {
            case UP -> 0;
            case DEGRADED -> EXIT_DEGRADED;
            case DOWN -> EXIT_DOWN;
        };
    }
}
