package com.gtmalpha.research.orchestration.retry;

public record RetryResult<T>(Status status, CallOutcome<T> last, int attempts) {
    public enum Status {
        SUCCEEDED,
        SHORT_CIRCUITED,
        EXHAUSTED,
        CANCELLED
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    public boolean isCancelled() {
        return status == Status.CANCELLED;
    }
}
