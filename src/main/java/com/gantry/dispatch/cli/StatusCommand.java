package com.gantry.dispatch.cli;

import com.gantry.core.admission.BreakerRecord;
import com.gantry.core.admission.DegradationLevel;
import com.gantry.core.health.OpsStatus;
import com.gantry.core.health.OpsStatusService;
import com.gantry.core.model.TaskStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.Map;

/**
 * CLI command: gantry status
 * <p>
 * Task counts by status, running jobs, degradation level and breaker states.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show orchestrator status")
@Component
public class StatusCommand implements Runnable {

    private final OpsStatusService opsStatusService;

    public StatusCommand(OpsStatusService opsStatusService) {
        this.opsStatusService = opsStatusService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        OpsStatus status = opsStatusService.status();

        String level = String.format("Degradation: %s (failure rate %.2f, saturation %.2f)",
                status.degradationLevel(), status.failureRate(), status.saturation());
        if (status.degradationLevel() == DegradationLevel.NORMAL) {
            ConsoleOutput.success(level);
        } else {
            ConsoleOutput.error(level);
        }
        ConsoleOutput.info("Running jobs: " + status.runningJobs());

        System.out.println();
        System.out.printf("  %-12s %s%n", "STATUS", "TASKS");
        System.out.println("  " + "-".repeat(20));
        for (Map.Entry<TaskStatus, Long> entry : status.tasksByStatus().entrySet()) {
            System.out.printf("  %-12s %d%n", entry.getKey(), entry.getValue());
        }

        if (!status.breakers().isEmpty()) {
            System.out.println();
            System.out.printf("  %-16s %-10s %s%n", "EXECUTOR", "BREAKER", "FAILURES");
            System.out.println("  " + "-".repeat(36));
            for (BreakerRecord breaker : status.breakers()) {
                System.out.printf("  %-16s %-10s %d%n", breaker.executor(), breaker.state(),
                        breaker.consecutiveFailures());
            }
        }
    }
}
