package com.gtmalpha.research.orchestration.provider;

import com.gtmalpha.research.orchestration.model.AttemptOutcome;
import com.gtmalpha.research.orchestration.util.OutcomeClassifier;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ProviderResponse(
    AttemptOutcome outcome,
    Map<String, Object> content,
    BigDecimal cost,
    String reasonCode,
    String rawPayload
) {
    public ProviderResponse {
        if (outcome == null || !outcome.reachedProvider()) {
            throw new IllegalArgumentException("provider responses are success, retryable or terminal: " + outcome);
        }
        cost = cost == null || cost.signum() < 0 ? BigDecimal.ZERO : cost;
        content = content == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(content));
    }

    public static ProviderResponse success(Map<String, Object> content, BigDecimal cost, String rawPayload) {
        return new ProviderResponse(AttemptOutcome.SUCCESS, content, cost, null, rawPayload);
    }

    public static ProviderResponse failure(String reasonCode, BigDecimal cost) {
        return new ProviderResponse(OutcomeClassifier.classify(reasonCode), null, cost, reasonCode, null);
    }

    public static ProviderResponse retryable(String reasonCode) {
        return new ProviderResponse(AttemptOutcome.RETRYABLE_FAILURE, null, BigDecimal.ZERO, reasonCode, null);
    }

    public static ProviderResponse terminal(String reasonCode) {
        return new ProviderResponse(AttemptOutcome.TERMINAL_FAILURE, null, BigDecimal.ZERO, reasonCode, null);
    }

    public boolean isSuccess() {
        return outcome == AttemptOutcome.SUCCESS;
    }
}
