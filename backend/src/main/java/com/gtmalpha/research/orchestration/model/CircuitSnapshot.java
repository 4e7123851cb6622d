package com.gtmalpha.research.orchestration.model;

import java.time.Instant;

public record CircuitSnapshot(
    String providerId,
    CircuitState state,
    int windowCalls,
    double failureRate,
    Instant cooldownUntil,
    long transitions
) {
}
