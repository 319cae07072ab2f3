package com.gantry.dispatch.cli;

import com.gantry.GantryApplication;
import com.gantry.core.persistence.RecordNotFoundException;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs one picocli command per process and hands its exit code to Spring Boot.
 * Commands are Spring beans, created through the picocli-spring factory.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    /** A task or job named on the command line does not exist. */
    static final int EXIT_NOT_FOUND = 3;

    private final GantryCommand gantryCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(GantryCommand gantryCommand, IFactory factory) {
        this.gantryCommand = gantryCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (GantryApplication.serving(args)) {
            // the web server owns the process; ServeCommand only prints the banner
            return;
        }
        exitCode = commandLine().execute(args);
    }

    CommandLine commandLine() {
        return new CommandLine(gantryCommand, factory)
                .setExitCodeExceptionMapper(e -> e instanceof RecordNotFoundException
                        ? EXIT_NOT_FOUND : CommandLine.ExitCode.SOFTWARE);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
