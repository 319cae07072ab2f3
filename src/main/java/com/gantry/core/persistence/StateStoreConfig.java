package com.gantry.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Selects the {@link StateStore} backend from {@code gantry.state.backend}.
 * <p>
 * {@code jdbc} builds a pooled DataSource from {@code gantry.state.jdbc.*} and
 * persists records to the {@code gantry_state} table. Anything else, including
 * no setting at all, falls back to the in-memory store, which is suitable for
 * development and testing but not durable across restarts.
 */
@Configuration
public class StateStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StateStoreConfig.class);

    @Bean
    @ConditionalOnProperty(name = "gantry.state.backend", havingValue = "jdbc")
    public StateStore jdbcStateStore(StateProperties properties) throws Exception {
        var jdbc = properties.getJdbc();
        if (jdbc.getUrl() == null || jdbc.getUrl().isBlank()) {
            throw new IllegalStateException("gantry.state.backend=jdbc requires gantry.state.jdbc.url");
        }
        log.info("Configuring JDBC state store at {}", jdbc.getUrl());
        DataSource dataSource = DataSourceBuilder.create()
                .url(jdbc.getUrl())
                .username(jdbc.getUsername())
                .password(jdbc.getPassword())
                .build();
        var store = new JdbcStateStore(dataSource, properties.getLockTimeout(), properties.isStrictWrites());
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnProperty(name = "gantry.state.backend", havingValue = "memory", matchIfMissing = true)
    public StateStore memoryStateStore(StateProperties properties) {
        log.info("Using in-memory state store (state will not persist across restarts)");
        return new InMemoryStateStore(properties.getLockTimeout(), properties.isStrictWrites());
    }
}
