package com.gantry.core.scheduler;

import com.gantry.executor.ExecutorProperties;
import com.gantry.executor.ExecutorRegistry;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ExecutorHealthProbe {

    private final ExecutorRegistry registry;
    private final ExecutorProperties properties;

    public ExecutorHealthProbe(ExecutorRegistry registry, ExecutorProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${gantry.executors.health-check-ms:30000}")
    public void probe() {
        registry.refreshHealth(properties.getHealthTimeout());
    }
}
