package com.gantry.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Builds the {@link ExecutorRegistry} from {@code gantry.executors.definitions},
 * one {@link ProcessExecutorBackend} per definition.
 */
@Configuration
public class ExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutorConfig.class);

    @Bean
    public ExecutorRegistry executorRegistry(ExecutorProperties properties) {
        var registry = new ExecutorRegistry();
        Path repositoryDir = Path.of(properties.getRepositoryDir());
        for (ExecutorProperties.Definition definition : properties.getDefinitions()) {
            if (definition.getName() == null || definition.getName().isBlank()) {
                throw new IllegalStateException("Executor definition without a name");
            }
            var backend = new ProcessExecutorBackend(definition.getName(), definition.commandLine(),
                    repositoryDir, definition.getEnv(), definition.getHealthCommand());
            registry.register(new ExecutorDescriptor(definition.getName(), definition.getPriority(),
                    Math.max(1, definition.getMaxConcurrency()), definition.getTimeout()), backend);
        }
        if (properties.getDefinitions().isEmpty()) {
            log.warn("No executors configured; tasks will wait in their lanes");
        }
        return registry;
    }
}
