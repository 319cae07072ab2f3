package com.gantry.core.security;

import com.gantry.core.model.ReasonCodes;
import com.gantry.core.model.TaskScope;
import com.gantry.core.pins.PinsResolver;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps roles to capabilities and checks scopes and tool usage against them.
 */
@Service
public class RolePolicyEngine {

    private final RoleRegistry registry;
    private final PinsResolver pinsResolver;

    public RolePolicyEngine(RoleRegistry registry, PinsResolver pinsResolver) {
        this.registry = registry;
        this.pinsResolver = pinsResolver;
    }

    /**
     * @throws UnknownRoleException if the role is not registered
     */
    public RoleCapabilities capabilitiesFor(String role) {
        return registry.require(role);
    }

    public boolean isKnownRole(String role) {
        return registry.find(role).isPresent();
    }

    /**
     * Validates a declared scope against the role. Returns reason codes with
     * detail ({@code CODE:detail}); empty when the scope is acceptable.
     */
    public List<String> validateScope(String role, TaskScope scope) {
        var caps = capabilitiesFor(role);
        var reasons = new ArrayList<String>();
        if (caps.pinsRequired() && scope.allowedPaths().isEmpty()) {
            reasons.add(ReasonCodes.PINS_INSUFFICIENT);
            return reasons;
        }
        for (String pattern : pinsResolver.uncovered(scope.allowedPaths(), caps.pathPatterns())) {
            reasons.add(ReasonCodes.ROLE_POLICY_VIOLATION + ":path_outside_role:" + pattern);
        }
        return reasons;
    }

    /**
     * Returns the tools in {@code toolsUsed} the role may not use.
     * A denied pattern wins over an allowed one.
     */
    public List<String> checkTools(String role, List<String> toolsUsed) {
        var caps = capabilitiesFor(role);
        var violations = new ArrayList<String>();
        for (String tool : toolsUsed) {
            if (!isToolAllowed(caps, tool)) {
                violations.add(tool);
            }
        }
        return violations;
    }

    public boolean isToolAllowed(RoleCapabilities caps, String tool) {
        for (String pattern : caps.deniedTools()) {
            if (matches(pattern, tool)) {
                return false;
            }
        }
        if (caps.allowedTools().isEmpty()) {
            return true;
        }
        for (String pattern : caps.allowedTools()) {
            if (matches(pattern, tool)) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(String pattern, String tool) {
        if (pattern.endsWith("*")) {
            String prefix = pattern.substring(0, pattern.length() - 1);
            return tool.startsWith(prefix);
        }
        return pattern.equals(tool);
    }
}
