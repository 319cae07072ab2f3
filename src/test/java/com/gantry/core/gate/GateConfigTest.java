package com.gantry.core.gate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GateConfigTest {

    @Test
    void gatePoolIsSizedByConcurrency() {
        var properties = new GateProperties();
        properties.setConcurrency(2);

        var executor = new GateConfig().gateExecutor(properties);

        assertEquals(2, executor.getCorePoolSize());
        assertEquals(2, executor.getMaxPoolSize());
        assertEquals("gantry-gate-", executor.getThreadNamePrefix());
    }
}
