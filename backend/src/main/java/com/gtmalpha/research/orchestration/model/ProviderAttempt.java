package com.gtmalpha.research.orchestration.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ProviderAttempt(
    String providerId,
    String costClass,
    int attemptNumber,
    Instant startedAt,
    Instant finishedAt,
    AttemptOutcome outcome,
    String reasonCode,
    BigDecimal cost,
    String payloadRef,
    Map<String, Object> content,
    boolean qualityAccepted
) {
    public ProviderAttempt {
        cost = cost == null ? BigDecimal.ZERO : cost;
        content = content == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(content));
    }

    public static ProviderAttempt skipped(
        String providerId,
        String costClass,
        int attemptNumber,
        AttemptOutcome outcome,
        String reasonCode,
        Instant at
    ) {
        return new ProviderAttempt(providerId, costClass, attemptNumber, at, at, outcome, reasonCode, BigDecimal.ZERO, null, null, false);
    }

    public boolean isSuccess() {
        return outcome == AttemptOutcome.SUCCESS;
    }

    public ProviderAttempt withPayloadRef(String ref) {
        return new ProviderAttempt(
            providerId, costClass, attemptNumber, startedAt, finishedAt, outcome, reasonCode, cost, ref, content, qualityAccepted
        );
    }

    public ProviderAttempt withQualityAccepted(boolean accepted) {
        return new ProviderAttempt(
            providerId, costClass, attemptNumber, startedAt, finishedAt, outcome, reasonCode, cost, payloadRef, content, accepted
        );
    }
}
