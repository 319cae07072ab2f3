package com.gantry.dispatch.cli;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: gantry serve
 * <p>
 * Runs the REST API and the scheduler until stopped. The web server is
 * enabled by {@link com.gantry.GantryApplication#main} detecting "serve" in
 * the arguments; {@link CliRunner} then skips picocli entirely, so
 * {@link #run()} only serves {@code --help} and subcommand registration.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Start the Gantry HTTP server and scheduler")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    @Override
    public void run() {
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Gantry server running on port " + port);
        System.out.println();
        System.out.println("  API:     http://localhost:" + port + "/api/v1");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }
}
