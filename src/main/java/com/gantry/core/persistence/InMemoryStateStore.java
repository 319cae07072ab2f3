package com.gantry.core.persistence;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable {@link StateStore}, used when no database is configured.
 * State is lost on restart.
 */
public class InMemoryStateStore extends AbstractStateStore {

    private final Map<StateNamespace, ConcurrentHashMap<String, VersionedRecord>> records = new ConcurrentHashMap<>();

    public InMemoryStateStore(Duration lockTimeout, boolean strictWrites) {
        super(lockTimeout, strictWrites);
    }

    private ConcurrentHashMap<String, VersionedRecord> space(StateNamespace namespace) {
        return records.computeIfAbsent(namespace, ns -> new ConcurrentHashMap<>());
    }

    @Override
    public Optional<VersionedRecord> read(StateNamespace namespace, String key) {
        return Optional.ofNullable(space(namespace).get(key));
    }

    @Override
    public List<VersionedRecord> list(StateNamespace namespace) {
        var result = new ArrayList<>(space(namespace).values());
        result.sort(Comparator.comparing(VersionedRecord::key));
        return result;
    }

    @Override
    public boolean compareAndSet(StateNamespace namespace, String key, long expectedVersion, String body) {
        boolean[] applied = {false};
        space(namespace).compute(key, (k, current) -> {
            long currentVersion = current == null ? 0L : current.version();
            if (currentVersion != expectedVersion) {
                return current;
            }
            applied[0] = true;
            return new VersionedRecord(k, currentVersion + 1, body);
        });
        return applied[0];
    }

    @Override
    public boolean isHealthy() {
        return true;
    }

    @Override
    public String backendName() {
        return "memory";
    }
}
