package com.gantry;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.Arrays;
import java.util.Map;

/**
 * Entry point. {@code gantry serve} starts the REST API and the scheduler
 * loop; any other command runs once against the state store and exits with
 * the command's exit code.
 */
@SpringBootApplication
public class GantryApplication {

    static final String SERVE = "serve";

    public static void main(String[] args) {
        boolean serving = serving(args);
        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(GantryApplication.class)
                .properties(modeProperties(serving))
                .run(args);
        if (!serving) {
            System.exit(SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class)));
        }
    }

    /** True when the arguments ask for the long-running server. */
    public static boolean serving(String... args) {
        return Arrays.asList(args).contains(SERVE);
    }

    /**
     * Properties fixed by the run mode. One-shot commands get neither a web
     * server nor the scheduler, so inspecting the board never dispatches work.
     */
    static Map<String, Object> modeProperties(boolean serving) {
        return Map.of(
                "spring.main.web-application-type", serving ? "servlet" : "none",
                "spring.main.banner-mode", "off",
                "gantry.scheduler.enabled", serving);
    }
}
