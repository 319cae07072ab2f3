package com.gantry.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Gantry.
 */
@Command(
        name = "gantry",
        mixinStandardHelpOptions = true,
        version = "Gantry 0.1.0",
        description = "Task orchestration core for coding agents",
        subcommands = {
                ServeCommand.class,
                StatusCommand.class,
                LanesCommand.class,
                HealthCommand.class,
                CancelCommand.class,
                VerdictCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class GantryCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
