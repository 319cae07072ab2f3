package com.gantry.core.security;

import com.gantry.core.pins.InvalidPatternException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RoleRegistryTest {

    private static RolePolicyProperties properties() {
        var properties = new RolePolicyProperties();
        properties.getPathClasses().put("source", List.of("src/main/**"));
        properties.getPathClasses().put("docs", List.of("docs/**", "*.md"));
        var engineer = new RolePolicyProperties.RoleDefinition();
        engineer.setPathClasses(List.of("source", "docs"));
        engineer.setAllowedTools(List.of("git *"));
        engineer.setTestsRequired(true);
        engineer.setExecutors(List.of("claude"));
        properties.getDefinitions().put("Engineer", engineer);
        return properties;
    }

    @Test
    void resolvesPathClassesIntoPatterns() {
        var registry = new RoleRegistry(properties());

        var caps = registry.require("engineer");

        assertEquals("engineer", caps.role());
        assertEquals(List.of("src/main/**", "docs/**", "*.md"), caps.pathPatterns());
        assertEquals(List.of("source", "docs"), caps.pathClasses());
        assertTrue(caps.testsRequired());
        assertTrue(caps.pinsRequired());
        assertFalse(caps.networkAllowed());
        assertEquals(List.of("claude"), caps.executors());
    }

    @Test
    void roleNamesAreCaseInsensitive() {
        var registry = new RoleRegistry(properties());
        assertTrue(registry.find(" ENGINEER ").isPresent());
        assertEquals(Set.of("engineer"), registry.roles());
    }

    @Test
    void unknownRoleThrows() {
        var registry = new RoleRegistry(properties());
        var e = assertThrows(UnknownRoleException.class, () -> registry.require("janitor"));
        assertEquals("janitor", e.getRole());
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    void undefinedPathClassFailsStartup() {
        var properties = properties();
        properties.getDefinitions().get("Engineer").setPathClasses(List.of("infra"));
        var e = assertThrows(IllegalStateException.class, () -> new RoleRegistry(properties));
        assertTrue(e.getMessage().contains("infra"));
    }

    @Test
    void malformedPathClassPatternFailsStartup() {
        var properties = properties();
        properties.getPathClasses().put("source", List.of("/abs/**"));
        assertThrows(InvalidPatternException.class, () -> new RoleRegistry(properties));
    }
}
