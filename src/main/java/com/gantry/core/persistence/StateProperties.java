package com.gantry.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "gantry.state")
public class StateProperties {

    private String backend = "memory";
    private Duration lockTimeout = Duration.ofSeconds(2);
    private boolean strictWrites = true;
    private Jdbc jdbc = new Jdbc();

    public String getBackend() { return backend; }
    public void setBackend(String backend) { this.backend = backend; }
    public Duration getLockTimeout() { return lockTimeout; }
    public void setLockTimeout(Duration lockTimeout) { this.lockTimeout = lockTimeout; }
    public boolean isStrictWrites() { return strictWrites; }
    public void setStrictWrites(boolean strictWrites) { this.strictWrites = strictWrites; }
    public Jdbc getJdbc() { return jdbc; }
    public void setJdbc(Jdbc jdbc) { this.jdbc = jdbc; }

    public static class Jdbc {
        private String url;
        private String username;
        private String password;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }
}
