package com.gantry.core.persistence;

import org.springframework.stereotype.Component;

/**
 * Monotonic counters kept in the {@link StateNamespace#SEQUENCES} namespace.
 */
@Component
public class SequenceGenerator {

    private final StateStore store;

    public SequenceGenerator(StateStore store) {
        this.store = store;
    }

    public long next(String name) {
        var written = store.update(StateNamespace.SEQUENCES, name,
                body -> String.valueOf(body == null ? 1L : Long.parseLong(body.trim()) + 1L));
        return Long.parseLong(written.body());
    }
}
