package com.gantry.core.gate;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool gate commands run on, kept apart from the scheduler threads.
 */
@Configuration
public class GateConfig {

    public static final String GATE_EXECUTOR = "gateExecutor";

    @Bean(name = GATE_EXECUTOR)
    public ThreadPoolTaskExecutor gateExecutor(GateProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getConcurrency());
        executor.setMaxPoolSize(properties.getConcurrency());
        executor.setThreadNamePrefix("gantry-gate-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
