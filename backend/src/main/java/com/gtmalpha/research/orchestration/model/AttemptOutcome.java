package com.gtmalpha.research.orchestration.model;

public enum AttemptOutcome {
    SUCCESS,
    RETRYABLE_FAILURE,
    TERMINAL_FAILURE,
    BUDGET_BLOCKED,
    CIRCUIT_OPEN;

    public boolean reachedProvider() {
        return this == SUCCESS || this == RETRYABLE_FAILURE || this == TERMINAL_FAILURE;
    }
}
