package com.gantry.core.gate;

import com.gantry.core.model.GateCategory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "gantry.gates")
public class GateProperties {

    private List<GateDefinition> definitions = new ArrayList<>();
    private int concurrency = 4;

    public List<GateDefinition> getDefinitions() { return definitions; }
    public void setDefinitions(List<GateDefinition> definitions) { this.definitions = definitions; }
    public int getConcurrency() { return concurrency; }
    public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

    /** Names of gates that must run before a job can be judged DONE. */
    public Set<String> requiredGates() {
        var names = new LinkedHashSet<String>();
        for (GateDefinition definition : definitions) {
            if (definition.isRequired()) {
                names.add(definition.getName());
            }
        }
        return names;
    }

    public static class GateDefinition {
        private String name;
        private GateCategory category = GateCategory.CI;
        private boolean required = true;
        private List<String> command = new ArrayList<>();
        private Duration timeout = Duration.ofMinutes(5);

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public GateCategory getCategory() { return category; }
        public void setCategory(GateCategory category) { this.category = category; }
        public boolean isRequired() { return required; }
        public void setRequired(boolean required) { this.required = required; }
        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }
}
