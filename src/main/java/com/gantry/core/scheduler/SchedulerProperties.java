package com.gantry.core.scheduler;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "gantry.scheduler")
public class SchedulerProperties {

    private boolean enabled = true;
    private long tickMs = 2000;
    private long watchdogMs = 15000;
    private Duration watchdogGrace = Duration.ofSeconds(30);
    private int poolSize = 3;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public long getTickMs() { return tickMs; }
    public void setTickMs(long tickMs) { this.tickMs = tickMs; }
    public long getWatchdogMs() { return watchdogMs; }
    public void setWatchdogMs(long watchdogMs) { this.watchdogMs = watchdogMs; }
    public Duration getWatchdogGrace() { return watchdogGrace; }
    public void setWatchdogGrace(Duration watchdogGrace) { this.watchdogGrace = watchdogGrace; }
    public int getPoolSize() { return poolSize; }
    public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
}
