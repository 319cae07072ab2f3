package com.gantry.core.scheduler;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Turns on the scheduler tick, the watchdog and the executor health probe.
 * CLI runs switch it off so a one-shot command never dispatches work.
 * <p>
 * Each of the three gets a thread of its own, so a slow tick cannot hold back
 * the watchdog sweep.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "gantry.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {

    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler(SchedulerProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(3, properties.getPoolSize()));
        scheduler.setThreadNamePrefix("gantry-sched-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
