package com.gtmalpha.research.orchestration.retry;

import com.gtmalpha.research.orchestration.model.AttemptOutcome;

public record CallOutcome<T>(AttemptOutcome outcome, String reasonCode, T value) {
    public static <T> CallOutcome<T> success(T value) {
        return new CallOutcome<>(AttemptOutcome.SUCCESS, null, value);
    }

    public static <T> CallOutcome<T> of(AttemptOutcome outcome, String reasonCode, T value) {
        return new CallOutcome<>(outcome, reasonCode, value);
    }

    public boolean isSuccess() {
        return outcome == AttemptOutcome.SUCCESS;
    }

    public boolean isRetryable() {
        return outcome == AttemptOutcome.RETRYABLE_FAILURE;
    }
}
