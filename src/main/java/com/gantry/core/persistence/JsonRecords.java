package com.gantry.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Typed view over one {@link StateNamespace}, mapping record bodies to {@code T} with Jackson.
 *
 * @param <T> record type stored in the namespace
 */
public class JsonRecords<T> {

    private final StateStore store;
    private final StateNamespace namespace;
    private final Class<T> type;
    private final ObjectMapper objectMapper;

    public JsonRecords(StateStore store, StateNamespace namespace, Class<T> type, ObjectMapper objectMapper) {
        this.store = store;
        this.namespace = namespace;
        this.type = type;
        this.objectMapper = objectMapper;
    }

    public Optional<T> get(String key) {
        return store.read(namespace, key).map(r -> deserialize(r.body()));
    }

    public List<T> list() {
        return store.list(namespace).stream().map(r -> deserialize(r.body())).toList();
    }

    public List<T> listByPrefix(String prefix) {
        return store.list(namespace).stream()
                .filter(r -> r.key().startsWith(prefix))
                .map(r -> deserialize(r.body()))
                .toList();
    }

    /**
     * Stores a new record.
     *
     * @throws StateConflictException if the key already exists
     */
    public T create(String key, T value) {
        if (!store.compareAndSet(namespace, key, 0L, serialize(value))) {
            throw new StateConflictException(namespace.storeName() + "/" + key + " already exists");
        }
        return value;
    }

    /**
     * Lock-scoped read-modify-write of an existing record.
     *
     * @throws RecordNotFoundException if the key does not exist
     */
    public T update(String key, UnaryOperator<T> mutator) {
        var written = store.update(namespace, key, body -> {
            if (body == null) {
                throw new RecordNotFoundException(namespace.storeName() + "/" + key + " not found");
            }
            return serialize(mutator.apply(deserialize(body)));
        });
        return deserialize(written.body());
    }

    /** Like {@link #update} but seeds a missing record from {@code initial} first. */
    public T upsert(String key, Supplier<T> initial, UnaryOperator<T> mutator) {
        var written = store.update(namespace, key, body -> {
            T current = body == null ? initial.get() : deserialize(body);
            return serialize(mutator.apply(current));
        });
        return deserialize(written.body());
    }

    private String serialize(T value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + type.getSimpleName(), e);
        }
    }

    private T deserialize(String body) {
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
