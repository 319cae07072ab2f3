package com.gantry.core.persistence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStateStoreTest {

    private InMemoryStateStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryStateStore(Duration.ofMillis(200), true);
    }

    @Nested
    @DisplayName("compareAndSet")
    class CompareAndSet {

        @Test
        void createRequiresAbsentKey() {
            assertTrue(store.compareAndSet(StateNamespace.TASKS, "T-1", 0L, "{\"a\":1}"));
            assertFalse(store.compareAndSet(StateNamespace.TASKS, "T-1", 0L, "{\"a\":2}"));
            assertEquals("{\"a\":1}", store.read(StateNamespace.TASKS, "T-1").orElseThrow().body());
        }

        @Test
        void staleVersionIsRejected() {
            store.compareAndSet(StateNamespace.TASKS, "T-1", 0L, "v1");
            assertTrue(store.compareAndSet(StateNamespace.TASKS, "T-1", 1L, "v2"));
            assertFalse(store.compareAndSet(StateNamespace.TASKS, "T-1", 1L, "v3"));

            var record = store.read(StateNamespace.TASKS, "T-1").orElseThrow();
            assertEquals(2L, record.version());
            assertEquals("v2", record.body());
        }

        @Test
        void namespacesAreIndependent() {
            store.compareAndSet(StateNamespace.TASKS, "same", 0L, "task");
            assertTrue(store.compareAndSet(StateNamespace.JOBS, "same", 0L, "job"));
            assertEquals(1, store.list(StateNamespace.JOBS).size());
            assertTrue(store.read(StateNamespace.POLICY, "same").isEmpty());
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        void seedsMissingKeyAndBumpsVersion() {
            var first = store.update(StateNamespace.SEQUENCES, "n", body -> body == null ? "1" : body + "+");
            var second = store.update(StateNamespace.SEQUENCES, "n", body -> body + "+");

            assertEquals(1L, first.version());
            assertEquals(2L, second.version());
            assertEquals("1+", second.body());
        }

        @Test
        void mutatorExceptionPropagatesAndNothingIsWritten() {
            store.compareAndSet(StateNamespace.TASKS, "T-1", 0L, "v1");

            assertThrows(IllegalStateException.class, () -> store.update(StateNamespace.TASKS, "T-1", body -> {
                throw new IllegalStateException("guard failed");
            }));
            assertEquals(1L, store.read(StateNamespace.TASKS, "T-1").orElseThrow().version());
        }

        @Test
        void nullBodyIsRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> store.update(StateNamespace.TASKS, "T-1", body -> null));
        }

        @Test
        void persistentCasLossesGiveUpWithConflict() {
            var losing = new InMemoryStateStore(Duration.ofMillis(200), true) {
                @Override
                public boolean compareAndSet(StateNamespace namespace, String key, long expectedVersion, String body) {
                    return false;
                }
            };
            assertThrows(StateConflictException.class,
                    () -> losing.update(StateNamespace.TASKS, "T-1", body -> "x"));
        }
    }

    @Nested
    @DisplayName("lock timeout")
    class LockTimeout {

        private ExecutorService holder;

        @BeforeEach
        void startHolder() {
            holder = Executors.newSingleThreadExecutor();
        }

        private void holdLock(AbstractStateStore target, CountDownLatch release) throws Exception {
            var held = new CountDownLatch(1);
            holder.submit(() -> {
                var lock = target.lockFor(StateNamespace.TASKS, "T-1");
                lock.lock();
                try {
                    held.countDown();
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    lock.unlock();
                }
            });
            assertTrue(held.await(5, TimeUnit.SECONDS));
        }

        @Test
        void strictStoreFailsTheWrite() throws Exception {
            var release = new CountDownLatch(1);
            holdLock(store, release);
            try {
                assertThrows(StateWriteTimeoutException.class,
                        () -> store.update(StateNamespace.TASKS, "T-1", body -> "x"));
                assertTrue(store.read(StateNamespace.TASKS, "T-1").isEmpty());
            } finally {
                release.countDown();
                holder.shutdown();
            }
        }

        @Test
        void nonStrictStoreWritesWithoutTheLock() throws Exception {
            var lenient = new InMemoryStateStore(Duration.ofMillis(100), false);
            var release = new CountDownLatch(1);
            holdLock(lenient, release);
            try {
                var written = lenient.update(StateNamespace.TASKS, "T-1", body -> "x");
                assertEquals(1L, written.version());
                assertFalse(lenient.isStrictWrites());
            } finally {
                release.countDown();
                holder.shutdown();
            }
        }
    }

    @Test
    void listIsOrderedByKey() {
        store.compareAndSet(StateNamespace.TASKS, "b", 0L, "2");
        store.compareAndSet(StateNamespace.TASKS, "a", 0L, "1");
        assertEquals("a", store.list(StateNamespace.TASKS).get(0).key());
        assertEquals("memory", store.backendName());
        assertTrue(store.isHealthy());
    }
}
