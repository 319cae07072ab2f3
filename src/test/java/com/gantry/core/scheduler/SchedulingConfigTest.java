package com.gantry.core.scheduler;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SchedulingConfigTest {

    private final SchedulingConfig config = new SchedulingConfig();

    @Test
    void tickWatchdogAndHealthCheckEachGetAThread() {
        var properties = new SchedulerProperties();
        properties.setPoolSize(1);

        var scheduler = config.taskScheduler(properties);

        assertEquals(3, scheduler.getPoolSize());
        assertEquals("gantry-sched-", scheduler.getThreadNamePrefix());
    }

    @Test
    void largerPoolIsHonoured() {
        var properties = new SchedulerProperties();
        properties.setPoolSize(5);

        assertEquals(5, config.taskScheduler(properties).getPoolSize());
    }
}
