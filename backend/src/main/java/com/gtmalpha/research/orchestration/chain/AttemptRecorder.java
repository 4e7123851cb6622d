package com.gtmalpha.research.orchestration.chain;

import com.gtmalpha.research.orchestration.model.ProviderAttempt;

@FunctionalInterface
public interface AttemptRecorder {
    ProviderAttempt record(ProviderAttempt attempt, String rawPayload);
}
