package com.gantry.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Implements {@link #update} on top of {@link #read} and {@link #compareAndSet}.
 * <p>
 * Writers to the same key are serialized by an in-process lock with a bounded
 * wait. If the lock is not acquired in time, strict stores fail the write;
 * non-strict stores log a warning and go ahead without the lock, relying on
 * the version check alone. Either way a lost CAS race is retried a few times
 * before giving up.
 */
public abstract class AbstractStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(AbstractStateStore.class);

    static final int MAX_CAS_ATTEMPTS = 5;

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration lockTimeout;
    private final boolean strictWrites;

    protected AbstractStateStore(Duration lockTimeout, boolean strictWrites) {
        this.lockTimeout = lockTimeout;
        this.strictWrites = strictWrites;
    }

    @Override
    public VersionedRecord update(StateNamespace namespace, String key, UnaryOperator<String> mutator) {
        String lockKey = namespace.storeName() + "/" + key;
        ReentrantLock lock = locks.computeIfAbsent(lockKey, k -> new ReentrantLock());
        boolean locked = acquire(lock, lockKey);
        try {
            return readModifyWrite(namespace, key, mutator);
        } finally {
            if (locked) {
                lock.unlock();
            }
        }
    }

    private boolean acquire(ReentrantLock lock, String lockKey) {
        try {
            if (lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StateWriteTimeoutException("Interrupted waiting for lock on " + lockKey);
        }
        if (strictWrites) {
            throw new StateWriteTimeoutException(
                    "Timed out after " + lockTimeout.toMillis() + "ms waiting for lock on " + lockKey);
        }
        log.warn("Lock wait on {} exceeded {}ms; continuing best-effort without the lock",
                lockKey, lockTimeout.toMillis());
        return false;
    }

    private VersionedRecord readModifyWrite(StateNamespace namespace, String key, UnaryOperator<String> mutator) {
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            Optional<VersionedRecord> current = read(namespace, key);
            long expected = current.map(VersionedRecord::version).orElse(0L);
            String next = mutator.apply(current.map(VersionedRecord::body).orElse(null));
            if (next == null) {
                throw new IllegalArgumentException("Mutator returned null body for " + key);
            }
            if (compareAndSet(namespace, key, expected, next)) {
                return new VersionedRecord(key, expected + 1, next);
            }
            log.debug("CAS miss on {}/{} at version {} (attempt {})",
                    namespace.storeName(), key, expected, attempt);
        }
        throw new StateConflictException("Gave up writing " + namespace.storeName() + "/" + key
                + " after " + MAX_CAS_ATTEMPTS + " version conflicts");
    }

    public boolean isStrictWrites() {
        return strictWrites;
    }

    /** Visible for tests that need to hold a record lock. */
    ReentrantLock lockFor(StateNamespace namespace, String key) {
        return locks.computeIfAbsent(namespace.storeName() + "/" + key, k -> new ReentrantLock());
    }
}
