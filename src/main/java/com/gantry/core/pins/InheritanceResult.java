package com.gantry.core.pins;

import java.util.List;

/**
 * Outcome of checking a child scope against its parent's.
 *
 * @param violations {@code allowed_not_subset:<pattern>} or {@code forbidden_relaxed:<pattern>} entries
 */
public record InheritanceResult(List<String> violations) {

    public InheritanceResult {
        violations = List.copyOf(violations);
    }

    public boolean ok() {
        return violations.isEmpty();
    }
}
