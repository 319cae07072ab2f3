package com.gantry.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "gantry.roles")
public class RolePolicyProperties {

    private Map<String, List<String>> pathClasses = new LinkedHashMap<>();
    private Map<String, RoleDefinition> definitions = new LinkedHashMap<>();

    public Map<String, List<String>> getPathClasses() {
        return pathClasses;
    }

    public void setPathClasses(Map<String, List<String>> pathClasses) {
        this.pathClasses = pathClasses;
    }

    public Map<String, RoleDefinition> getDefinitions() {
        return definitions;
    }

    public void setDefinitions(Map<String, RoleDefinition> definitions) {
        this.definitions = definitions;
    }

    public static class RoleDefinition {
        private List<String> allowedTools = new ArrayList<>();
        private List<String> deniedTools = new ArrayList<>();
        private List<String> pathClasses = new ArrayList<>();
        private boolean networkAllowed = false;
        private boolean pinsRequired = true;
        private boolean testsRequired = false;
        private List<String> executors = new ArrayList<>();

        public List<String> getAllowedTools() {
            return allowedTools;
        }

        public void setAllowedTools(List<String> allowedTools) {
            this.allowedTools = allowedTools;
        }

        public List<String> getDeniedTools() {
            return deniedTools;
        }

        public void setDeniedTools(List<String> deniedTools) {
            this.deniedTools = deniedTools;
        }

        public List<String> getPathClasses() {
            return pathClasses;
        }

        public void setPathClasses(List<String> pathClasses) {
            this.pathClasses = pathClasses;
        }

        public boolean isNetworkAllowed() {
            return networkAllowed;
        }

        public void setNetworkAllowed(boolean networkAllowed) {
            this.networkAllowed = networkAllowed;
        }

        public boolean isPinsRequired() {
            return pinsRequired;
        }

        public void setPinsRequired(boolean pinsRequired) {
            this.pinsRequired = pinsRequired;
        }

        public boolean isTestsRequired() {
            return testsRequired;
        }

        public void setTestsRequired(boolean testsRequired) {
            this.testsRequired = testsRequired;
        }

        public List<String> getExecutors() {
            return executors;
        }

        public void setExecutors(List<String> executors) {
            this.executors = executors;
        }
    }
}
