package com.gantry.core.pins;

import com.gantry.core.model.TaskScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides whether a path may be touched under a task's declared scope.
 * <p>
 * Precedence is fixed: an empty allowed set denies everything, a path that
 * escapes the repository root is denied, forbidden beats allowed, and anything
 * not explicitly allowed is denied.
 */
@Service
public class PinsResolver {

    private static final Logger log = LoggerFactory.getLogger(PinsResolver.class);

    private final ConcurrentHashMap<String, PathPattern> cache = new ConcurrentHashMap<>();

    public PinsDecision resolve(String candidatePath, List<String> allowedPaths, List<String> forbiddenPaths) {
        if (allowedPaths == null || allowedPaths.isEmpty()) {
            return PinsDecision.deny(candidatePath, "empty_allowed");
        }
        Optional<String> normalized = PathNormalizer.normalize(candidatePath);
        if (normalized.isEmpty()) {
            log.debug("Path '{}' escapes the repository root", candidatePath);
            return PinsDecision.deny(candidatePath, "path_escapes_root");
        }
        String path = normalized.get();
        if (forbiddenPaths != null) {
            for (String pattern : forbiddenPaths) {
                if (compile(pattern).matches(path)) {
                    return PinsDecision.deny(candidatePath, "forbidden:" + pattern);
                }
            }
        }
        for (String pattern : allowedPaths) {
            if (compile(pattern).matches(path)) {
                return PinsDecision.allow(candidatePath, "allowed:" + pattern);
            }
        }
        return PinsDecision.deny(candidatePath, "no_match");
    }

    public PinsDecision resolve(String candidatePath, TaskScope scope) {
        return resolve(candidatePath, scope.allowedPaths(), scope.forbiddenPaths());
    }

    /** Every denied path among {@code paths}, in input order. */
    public List<PinsDecision> denied(List<String> paths, TaskScope scope) {
        var result = new ArrayList<PinsDecision>();
        for (String path : paths) {
            var decision = resolve(path, scope);
            if (!decision.allowed()) {
                result.add(decision);
            }
        }
        return result;
    }

    /**
     * Compiles every pattern of a scope, returning one message per malformed pattern.
     */
    public List<String> validatePatterns(TaskScope scope) {
        var errors = new ArrayList<String>();
        for (String pattern : scope.allowedPaths()) {
            tryCompile(pattern, errors);
        }
        for (String pattern : scope.forbiddenPaths()) {
            tryCompile(pattern, errors);
        }
        return errors;
    }

    private void tryCompile(String pattern, List<String> errors) {
        try {
            compile(pattern);
        } catch (InvalidPatternException e) {
            errors.add(e.getMessage());
        }
    }

    /**
     * Checks that the child can never reach a path the parent would deny:
     * every child allowed pattern is covered by a parent allowed pattern, and
     * every parent forbidden pattern is covered by a child forbidden pattern.
     */
    public InheritanceResult validateInheritance(TaskScope child, TaskScope parent) {
        var violations = new ArrayList<String>();
        for (String pattern : uncovered(child.allowedPaths(), parent.allowedPaths())) {
            violations.add("allowed_not_subset:" + pattern);
        }
        for (String pattern : uncovered(parent.forbiddenPaths(), child.forbiddenPaths())) {
            violations.add("forbidden_relaxed:" + pattern);
        }
        return new InheritanceResult(violations);
    }

    /**
     * Patterns of {@code patterns} not covered by any pattern in {@code ceiling}.
     */
    public List<String> uncovered(List<String> patterns, List<String> ceiling) {
        var result = new ArrayList<String>();
        for (String pattern : patterns) {
            PathPattern compiled = compile(pattern);
            boolean covered = ceiling.stream().map(this::compile).anyMatch(c -> c.covers(compiled));
            if (!covered) {
                result.add(pattern);
            }
        }
        return result;
    }

    PathPattern compile(String pattern) {
        PathPattern cached = cache.get(pattern);
        if (cached != null) {
            return cached;
        }
        PathPattern compiled = PathPattern.compile(pattern);
        cache.put(pattern, compiled);
        return compiled;
    }
}
