package com.gantry.core.persistence;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcStateStoreTest {

    private JdbcStateStore store;

    @BeforeEach
    void setUp() throws Exception {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:gantry-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        store = new JdbcStateStore(dataSource, Duration.ofSeconds(1), true);
        store.createTables();
    }

    @Test
    void createTablesIsIdempotent() throws Exception {
        store.createTables();
        assertTrue(store.isHealthy());
        assertEquals("jdbc", store.backendName());
    }

    @Test
    void insertOnlySucceedsOnce() {
        assertTrue(store.compareAndSet(StateNamespace.TASKS, "TASK-0001", 0L, "{\"v\":1}"));
        assertFalse(store.compareAndSet(StateNamespace.TASKS, "TASK-0001", 0L, "{\"v\":2}"));

        var record = store.read(StateNamespace.TASKS, "TASK-0001").orElseThrow();
        assertEquals(1L, record.version());
        assertEquals("{\"v\":1}", record.body());
    }

    @Test
    void updateAppliesOnlyAtExpectedVersion() {
        store.compareAndSet(StateNamespace.JOBS, "JOB-00001", 0L, "a");

        assertTrue(store.compareAndSet(StateNamespace.JOBS, "JOB-00001", 1L, "b"));
        assertFalse(store.compareAndSet(StateNamespace.JOBS, "JOB-00001", 1L, "c"));
        assertEquals("b", store.read(StateNamespace.JOBS, "JOB-00001").orElseThrow().body());
    }

    @Test
    void readModifyWriteGoesThroughTheVersionColumn() {
        store.update(StateNamespace.SEQUENCES, "task", body -> body == null ? "1" : "x");
        var written = store.update(StateNamespace.SEQUENCES, "task", body -> String.valueOf(Long.parseLong(body) + 1));

        assertEquals(2L, written.version());
        assertEquals("2", store.read(StateNamespace.SEQUENCES, "task").orElseThrow().body());
    }

    @Test
    void listReturnsOneNamespaceInKeyOrder() {
        store.compareAndSet(StateNamespace.POLICY, "breaker:b", 0L, "{}");
        store.compareAndSet(StateNamespace.POLICY, "breaker:a", 0L, "{}");
        store.compareAndSet(StateNamespace.TASKS, "TASK-0001", 0L, "{}");

        var policy = store.list(StateNamespace.POLICY);
        assertEquals(2, policy.size());
        assertEquals("breaker:a", policy.get(0).key());
        assertTrue(store.read(StateNamespace.POLICY, "missing").isEmpty());
    }

    @Test
    void repositoriesWorkOnTopOfJdbc() {
        var sequences = new SequenceGenerator(store);
        var jobs = new JobRepository(store, sequences);

        assertEquals("JOB-00001", jobs.nextId());
        assertEquals("JOB-00002", jobs.nextId());
    }
}
