package com.gantry.executor;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "gantry.executors")
public class ExecutorProperties {

    private long healthCheckMs = 30_000;
    private Duration healthTimeout = Duration.ofSeconds(5);
    private String workDir = System.getProperty("java.io.tmpdir") + "/gantry-jobs";
    private String repositoryDir = ".";
    private List<Definition> definitions = new ArrayList<>();

    public long getHealthCheckMs() { return healthCheckMs; }
    public void setHealthCheckMs(long healthCheckMs) { this.healthCheckMs = healthCheckMs; }
    public Duration getHealthTimeout() { return healthTimeout; }
    public void setHealthTimeout(Duration healthTimeout) { this.healthTimeout = healthTimeout; }
    public String getWorkDir() { return workDir; }
    public void setWorkDir(String workDir) { this.workDir = workDir; }
    public String getRepositoryDir() { return repositoryDir; }
    public void setRepositoryDir(String repositoryDir) { this.repositoryDir = repositoryDir; }
    public List<Definition> getDefinitions() { return definitions; }
    public void setDefinitions(List<Definition> definitions) { this.definitions = definitions; }

    public static class Definition {
        private String name;
        private String command;
        private List<String> args = new ArrayList<>();
        private int priority = 100;
        private int maxConcurrency = 1;
        private Duration timeout = Duration.ofMinutes(10);
        private List<String> healthCommand = new ArrayList<>();
        private Map<String, String> env = new LinkedHashMap<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public List<String> getArgs() { return args; }
        public void setArgs(List<String> args) { this.args = args; }
        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }
        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public List<String> getHealthCommand() { return healthCommand; }
        public void setHealthCommand(List<String> healthCommand) { this.healthCommand = healthCommand; }
        public Map<String, String> getEnv() { return env; }
        public void setEnv(Map<String, String> env) { this.env = env; }

        /** Command line to launch: the command followed by its arguments. */
        public List<String> commandLine() {
            var line = new ArrayList<String>();
            line.add(command);
            line.addAll(args);
            return line;
        }
    }
}
