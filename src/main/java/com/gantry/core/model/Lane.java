package com.gantry.core.model;

import java.util.Locale;

/**
 * Queue a task is routed through. QUARANTINE and DLQ are escalation lanes:
 * tasks parked there are never admitted without operator action.
 */
public enum Lane {
    FASTLANE,
    MAINLANE,
    BATCHLANE,
    QUARANTINE,
    DLQ;

    public boolean escalation() {
        return this == QUARANTINE || this == DLQ;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a lane name case-insensitively.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static Lane parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Lane must not be blank");
        }
        return Lane.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
