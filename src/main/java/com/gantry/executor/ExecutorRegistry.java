package com.gantry.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registered executors with their per-executor concurrency budget and health flag.
 * <p>
 * Slots are tracked by job id, so releasing a job twice is harmless and
 * slots held by jobs that survived a restart can be re-claimed.
 */
public class ExecutorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExecutorRegistry.class);

    private static final class Entry {
        private final ExecutorDescriptor descriptor;
        private final ExecutorBackend backend;
        private final Set<String> jobs = ConcurrentHashMap.newKeySet();
        private final AtomicBoolean healthy = new AtomicBoolean(true);

        private Entry(ExecutorDescriptor descriptor, ExecutorBackend backend) {
            this.descriptor = descriptor;
            this.backend = backend;
        }
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public void register(ExecutorDescriptor descriptor, ExecutorBackend backend) {
        if (entries.putIfAbsent(descriptor.name(), new Entry(descriptor, backend)) != null) {
            throw new IllegalStateException("Executor " + descriptor.name() + " registered twice");
        }
        log.info("Registered executor {} (priority {}, concurrency {}, timeout {}s)", descriptor.name(),
                descriptor.priority(), descriptor.maxConcurrency(), descriptor.timeout().toSeconds());
    }

    public Optional<ExecutorDescriptor> find(String name) {
        return Optional.ofNullable(entries.get(name)).map(e -> e.descriptor);
    }

    public ExecutorBackend backend(String name) {
        Entry entry = entries.get(name);
        if (entry == null) {
            throw new IllegalArgumentException("Unknown executor: " + name);
        }
        return entry.backend;
    }

    /** All executors, lowest priority value first, then by name. */
    public List<ExecutorDescriptor> byPriority() {
        return entries.values().stream()
                .map(e -> e.descriptor)
                .sorted(Comparator.comparingInt(ExecutorDescriptor::priority).thenComparing(ExecutorDescriptor::name))
                .toList();
    }

    public boolean isHealthy(String name) {
        Entry entry = entries.get(name);
        return entry != null && entry.healthy.get();
    }

    public boolean hasCapacity(String name) {
        Entry entry = entries.get(name);
        return entry != null && entry.jobs.size() < entry.descriptor.maxConcurrency();
    }

    public int inFlight(String name) {
        Entry entry = entries.get(name);
        return entry == null ? 0 : entry.jobs.size();
    }

    /**
     * Claims a concurrency slot for {@code jobId}.
     *
     * @return false if the executor is unknown or at its ceiling
     */
    public boolean tryAcquire(String name, String jobId) {
        Entry entry = entries.get(name);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            if (entry.jobs.contains(jobId)) {
                return true;
            }
            if (entry.jobs.size() >= entry.descriptor.maxConcurrency()) {
                return false;
            }
            entry.jobs.add(jobId);
            return true;
        }
    }

    public void release(String name, String jobId) {
        Entry entry = entries.get(name);
        if (entry != null) {
            synchronized (entry) {
                entry.jobs.remove(jobId);
            }
        }
    }

    /**
     * Runs every executor's health probe, each bounded by {@code timeout}.
     */
    public void refreshHealth(Duration timeout) {
        for (Entry entry : entries.values()) {
            boolean healthy;
            try {
                healthy = entry.backend.healthCheck(timeout);
            } catch (RuntimeException e) {
                log.warn("Health probe for executor {} threw: {}", entry.descriptor.name(), e.getMessage());
                healthy = false;
            }
            boolean previous = entry.healthy.getAndSet(healthy);
            if (previous != healthy) {
                log.info("Executor {} is now {}", entry.descriptor.name(), healthy ? "healthy" : "UNHEALTHY");
            }
        }
    }

    void markHealthy(String name, boolean healthy) {
        Entry entry = entries.get(name);
        if (entry != null) {
            entry.healthy.set(healthy);
        }
    }
}
