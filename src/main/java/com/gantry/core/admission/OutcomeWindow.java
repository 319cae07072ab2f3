package com.gantry.core.admission;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Rolling window of recent job outcomes, newest last.
 */
public record OutcomeWindow(
    List<Boolean> outcomes,
    int schemaVersion
) implements Serializable {

    public OutcomeWindow {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static OutcomeWindow empty() {
        return new OutcomeWindow(List.of(), 1);
    }

    OutcomeWindow append(boolean success, int capacity) {
        var next = new ArrayList<>(outcomes);
        next.add(success);
        while (next.size() > capacity) {
            next.remove(0);
        }
        return new OutcomeWindow(next, schemaVersion);
    }

    double failureRate() {
        if (outcomes.isEmpty()) {
            return 0.0;
        }
        long failures = outcomes.stream().filter(ok -> !ok).count();
        return (double) failures / outcomes.size();
    }
}
