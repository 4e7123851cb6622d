package com.gtmalpha.research.orchestration.retry;

@FunctionalInterface
public interface RetryableCall<T> {
    CallOutcome<T> call(int attemptNumber) throws InterruptedException;
}
