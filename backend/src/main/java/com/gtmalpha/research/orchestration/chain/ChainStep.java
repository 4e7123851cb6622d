package com.gtmalpha.research.orchestration.chain;

import com.gtmalpha.research.orchestration.model.ProviderAttempt;

public record ChainStep(Kind kind, String providerId, ProviderAttempt lastAttempt) {
    public enum Kind {
        ACCEPTED,
        QUALITY_REJECTED,
        ESCALATE,
        CANCELLED
    }
}
