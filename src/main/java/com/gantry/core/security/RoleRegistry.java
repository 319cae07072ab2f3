package com.gantry.core.security;

import com.gantry.core.pins.PathPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of roles, resolved once from {@code gantry.roles} at startup.
 * <p>
 * Role names are case-insensitive. A role referencing an undefined path class,
 * or a path class holding a malformed pattern, fails startup.
 */
@Component
public class RoleRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoleRegistry.class);

    private final Map<String, RoleCapabilities> roles;

    public RoleRegistry(RolePolicyProperties properties) {
        var resolved = new LinkedHashMap<String, RoleCapabilities>();
        properties.getDefinitions().forEach((name, definition) -> {
            String role = normalize(name);
            resolved.put(role, resolve(role, definition, properties.getPathClasses()));
        });
        this.roles = Collections.unmodifiableMap(resolved);
        log.info("Role registry resolved {} roles: {}", roles.size(), roles.keySet());
    }

    private static RoleCapabilities resolve(String role, RolePolicyProperties.RoleDefinition definition,
                                            Map<String, List<String>> pathClasses) {
        var patterns = new ArrayList<String>();
        for (String pathClass : definition.getPathClasses()) {
            List<String> classPatterns = pathClasses.get(pathClass);
            if (classPatterns == null) {
                throw new IllegalStateException("Role '" + role + "' references undefined path class '"
                        + pathClass + "'");
            }
            classPatterns.forEach(PathPattern::compile);
            patterns.addAll(classPatterns);
        }
        return new RoleCapabilities(role,
                definition.getAllowedTools(),
                definition.getDeniedTools(),
                definition.getPathClasses(),
                patterns,
                definition.isNetworkAllowed(),
                definition.isPinsRequired(),
                definition.isTestsRequired(),
                definition.getExecutors());
    }

    public Optional<RoleCapabilities> find(String role) {
        if (role == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(roles.get(normalize(role)));
    }

    /**
     * @throws UnknownRoleException if the role is not registered
     */
    public RoleCapabilities require(String role) {
        return find(role).orElseThrow(() -> new UnknownRoleException(role));
    }

    public Set<String> roles() {
        return roles.keySet();
    }

    static String normalize(String role) {
        return role.trim().toLowerCase(Locale.ROOT);
    }
}
