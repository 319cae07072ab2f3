package com.gantry.dispatch.cli;

import com.gantry.core.admission.LaneSnapshot;
import com.gantry.core.health.OpsStatusService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: gantry lanes
 */
@Command(name = "lanes", mixinStandardHelpOptions = true, description = "Show lane occupancy and WIP ceilings")
@Component
public class LanesCommand implements Runnable {

    private final OpsStatusService opsStatusService;

    public LanesCommand(OpsStatusService opsStatusService) {
        this.opsStatusService = opsStatusService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        System.out.printf("  %-12s %-12s %-8s %s%n", "LANE", "IN_PROGRESS", "WIP", "WAITING");
        System.out.println("  " + "-".repeat(42));
        for (LaneSnapshot lane : opsStatusService.lanes()) {
            System.out.printf("  %-12s %-12d %-8d %d%n", lane.lane().key(), lane.inProgress(),
                    lane.wipLimit(), lane.waiting());
        }
    }
}
