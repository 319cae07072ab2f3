package com.gantry.core.security;

import java.util.List;

/**
 * Resolved, immutable capability set of one role.
 *
 * @param role           lower-cased role name
 * @param allowedTools   tool patterns the role may use; empty means any tool not denied
 * @param deniedTools    tool patterns the role must never use; deny wins
 * @param pathClasses    named path classes the role may write
 * @param pathPatterns   union of the patterns behind {@code pathClasses}; the scope ceiling
 * @param networkAllowed whether the executor may reach the network
 * @param pinsRequired   tasks for this role must declare a non-empty allowed scope
 * @param testsRequired  a DONE verdict needs passing tests
 * @param executors      executors preferred for this role, in order
 */
public record RoleCapabilities(
    String role,
    List<String> allowedTools,
    List<String> deniedTools,
    List<String> pathClasses,
    List<String> pathPatterns,
    boolean networkAllowed,
    boolean pinsRequired,
    boolean testsRequired,
    List<String> executors
) {

    public RoleCapabilities {
        allowedTools = List.copyOf(allowedTools);
        deniedTools = List.copyOf(deniedTools);
        pathClasses = List.copyOf(pathClasses);
        pathPatterns = List.copyOf(pathPatterns);
        executors = List.copyOf(executors);
    }
}
