package com.gantry.core.admission;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "gantry.admission")
public class AdmissionProperties {

    private Map<String, Integer> wipLimits = new LinkedHashMap<>(Map.of(
            "fastlane", 5, "mainlane", 10, "batchlane", 20));
    private double degradedWipFactor = 0.5;
    private Breaker breaker = new Breaker();
    private Degradation degradation = new Degradation();

    public Map<String, Integer> getWipLimits() { return wipLimits; }
    public void setWipLimits(Map<String, Integer> wipLimits) { this.wipLimits = wipLimits; }
    public double getDegradedWipFactor() { return degradedWipFactor; }
    public void setDegradedWipFactor(double degradedWipFactor) { this.degradedWipFactor = degradedWipFactor; }
    public Breaker getBreaker() { return breaker; }
    public void setBreaker(Breaker breaker) { this.breaker = breaker; }
    public Degradation getDegradation() { return degradation; }
    public void setDegradation(Degradation degradation) { this.degradation = degradation; }

    public static class Breaker {
        private int failureThreshold = 5;
        private Duration failureWindow = Duration.ofMinutes(10);
        private Duration cooldown = Duration.ofSeconds(60);
        private double cooldownMultiplier = 2.0;
        private Duration maxCooldown = Duration.ofMinutes(30);

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public Duration getFailureWindow() { return failureWindow; }
        public void setFailureWindow(Duration failureWindow) { this.failureWindow = failureWindow; }
        public Duration getCooldown() { return cooldown; }
        public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }
        public double getCooldownMultiplier() { return cooldownMultiplier; }
        public void setCooldownMultiplier(double cooldownMultiplier) { this.cooldownMultiplier = cooldownMultiplier; }
        public Duration getMaxCooldown() { return maxCooldown; }
        public void setMaxCooldown(Duration maxCooldown) { this.maxCooldown = maxCooldown; }
    }

    public static class Degradation {
        private int outcomeWindow = 50;
        private int minSamples = 10;
        private double degradedFailureRate = 0.3;
        private double criticalFailureRate = 0.6;
        private double degradedSaturation = 0.9;

        public int getOutcomeWindow() { return outcomeWindow; }
        public void setOutcomeWindow(int outcomeWindow) { this.outcomeWindow = outcomeWindow; }
        public int getMinSamples() { return minSamples; }
        public void setMinSamples(int minSamples) { this.minSamples = minSamples; }
        public double getDegradedFailureRate() { return degradedFailureRate; }
        public void setDegradedFailureRate(double degradedFailureRate) { this.degradedFailureRate = degradedFailureRate; }
        public double getCriticalFailureRate() { return criticalFailureRate; }
        public void setCriticalFailureRate(double criticalFailureRate) { this.criticalFailureRate = criticalFailureRate; }
        public double getDegradedSaturation() { return degradedSaturation; }
        public void setDegradedSaturation(double degradedSaturation) { this.degradedSaturation = degradedSaturation; }
    }
}
