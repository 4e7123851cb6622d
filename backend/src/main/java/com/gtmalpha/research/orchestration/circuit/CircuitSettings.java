package com.gtmalpha.research.orchestration.circuit;

import com.gtmalpha.research.config.ResearchProperties;

import java.time.Duration;

public record CircuitSettings(
    int windowSize,
    int minimumCalls,
    double failureRateThreshold,
    Duration cooldown,
    double cooldownMultiplier,
    Duration maxCooldown
) {
    public CircuitSettings {
        windowSize = Math.max(1, windowSize);
        minimumCalls = Math.max(1, Math.min(minimumCalls, windowSize));
        cooldownMultiplier = Math.max(1.0, cooldownMultiplier);
        if (maxCooldown.compareTo(cooldown) < 0) {
            maxCooldown = cooldown;
        }
    }

    public static CircuitSettings from(ResearchProperties.Circuit circuit) {
        return new CircuitSettings(
            circuit.getWindowSize(),
            circuit.getMinimumCalls(),
            circuit.getFailureRateThreshold(),
            Duration.ofSeconds(circuit.getCooldownSeconds()),
            circuit.getCooldownMultiplier(),
            Duration.ofSeconds(circuit.getMaxCooldownSeconds())
        );
    }

    public Duration nextCooldown(Duration current) {
        long nextMillis = (long) (current.toMillis() * cooldownMultiplier);
        return Duration.ofMillis(Math.min(nextMillis, maxCooldown.toMillis()));
    }
}
