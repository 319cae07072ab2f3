package com.gantry.core.persistence;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable, versioned key/value storage for tasks, jobs and policy state.
 * <p>
 * Every mutation goes through {@link #compareAndSet} with an explicit version
 * token, or through {@link #update}, which wraps a lock-scoped
 * read-modify-write around it.
 */
public interface StateStore {

    Optional<VersionedRecord> read(StateNamespace namespace, String key);

    List<VersionedRecord> list(StateNamespace namespace);

    /**
     * Writes {@code body} if the stored version equals {@code expectedVersion}.
     * An expected version of {@code 0} means "create, the key must not exist".
     *
     * @return true if the write was applied
     */
    boolean compareAndSet(StateNamespace namespace, String key, long expectedVersion, String body);

    /**
     * Read-modify-write under the per-key lock. The mutator receives the current
     * body, or null when the key is absent, and returns the body to store.
     *
     * @throws StateWriteTimeoutException if the lock is not acquired in time and
     *                                    strict writes are enabled
     * @throws StateConflictException     if concurrent writers keep winning the CAS
     */
    VersionedRecord update(StateNamespace namespace, String key, UnaryOperator<String> mutator);

    /** Lightweight probe used by the health check. */
    boolean isHealthy();

    String backendName();
}
