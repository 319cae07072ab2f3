package com.gantry.core.persistence;

/**
 * A stored JSON body together with its version token.
 * Versions start at 1 and grow by one on every successful write.
 */
public record VersionedRecord(
    String key,
    long version,
    String body
) {}
