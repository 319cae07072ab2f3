package com.gantry.core.persistence;

/**
 * Top-level record namespaces of the state store.
 */
public enum StateNamespace {
    TASKS("tasks"),
    JOBS("jobs"),
    POLICY("policy"),
    SEQUENCES("sequences");

    private final String storeName;

    StateNamespace(String storeName) {
        this.storeName = storeName;
    }

    public String storeName() {
        return storeName;
    }
}
