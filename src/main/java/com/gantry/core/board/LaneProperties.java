package com.gantry.core.board;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "gantry.lanes")
public class LaneProperties {

    /** Tasks at or below this priority value are routed to the fast lane. */
    private int urgentPriority = 1;
    private int defaultPriority = 3;
    private Map<String, String> areaLanes = new LinkedHashMap<>();
    /** Delay before the first retry after an infrastructure failure; doubles per attempt. */
    private Duration retryBackoff = Duration.ofSeconds(30);
    private Duration retryBackoffMax = Duration.ofMinutes(10);

    public int getUrgentPriority() { return urgentPriority; }
    public void setUrgentPriority(int urgentPriority) { this.urgentPriority = urgentPriority; }
    public int getDefaultPriority() { return defaultPriority; }
    public void setDefaultPriority(int defaultPriority) { this.defaultPriority = defaultPriority; }
    public Map<String, String> getAreaLanes() { return areaLanes; }
    public void setAreaLanes(Map<String, String> areaLanes) { this.areaLanes = areaLanes; }
    public Duration getRetryBackoff() { return retryBackoff; }
    public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }
    public Duration getRetryBackoffMax() { return retryBackoffMax; }
    public void setRetryBackoffMax(Duration retryBackoffMax) { this.retryBackoffMax = retryBackoffMax; }
}
