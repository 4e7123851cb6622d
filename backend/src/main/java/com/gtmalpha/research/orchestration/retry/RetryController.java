package com.gtmalpha.research.orchestration.retry;

import com.gtmalpha.research.orchestration.model.AttemptOutcome;
import com.gtmalpha.research.orchestration.service.StopSignal;
import com.gtmalpha.research.orchestration.util.OutcomeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class RetryController {
    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    private final int maxAttempts;
    private final BackoffPolicy backoff;
    private final Duration attemptTimeout;
    private final ExecutorService callExecutor;

    public RetryController(int maxAttempts, BackoffPolicy backoff, Duration attemptTimeout, ExecutorService callExecutor) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoff = backoff;
        this.attemptTimeout = attemptTimeout;
        this.callExecutor = callExecutor;
    }

    public <T> RetryResult<T> execute(String operation, RetryableCall<T> call, StopSignal stopSignal) {
        CallOutcome<T> last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                last = call.call(attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new RetryResult<>(RetryResult.Status.CANCELLED, last, attempt);
            }
            if (last == null) {
                last = CallOutcome.of(AttemptOutcome.TERMINAL_FAILURE, OutcomeClassifier.UNKNOWN, null);
            }
            if (last.isSuccess()) {
                return new RetryResult<>(RetryResult.Status.SUCCEEDED, last, attempt);
            }
            if (!last.isRetryable()) {
                return new RetryResult<>(RetryResult.Status.SHORT_CIRCUITED, last, attempt);
            }
            if (attempt >= maxAttempts) {
                break;
            }
            long waitMs = backoff.delayMillis(attempt);
            log.debug("{} attempt {} failed with {}, retrying in {} ms", operation, attempt, last.reasonCode(), waitMs);
            if (!waitBackoff(waitMs, stopSignal)) {
                return new RetryResult<>(RetryResult.Status.CANCELLED, last, attempt);
            }
        }
        log.debug("{} exhausted {} attempts, last reason {}", operation, maxAttempts, last == null ? null : last.reasonCode());
        return new RetryResult<>(RetryResult.Status.EXHAUSTED, last, maxAttempts);
    }

    /**
     * Runs one blocking call under the per-attempt timeout. On timeout or interruption the call is
     * cancelled before the exception is rethrown.
     */
    public <V> V invokeWithTimeout(Callable<V> body) throws TimeoutException, ExecutionException, InterruptedException {
        Future<V> future = callExecutor.submit(body);
        try {
            return future.get(attemptTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private boolean waitBackoff(long waitMs, StopSignal stopSignal) {
        if (stopSignal != null && stopSignal.isStopped()) {
            return false;
        }
        if (waitMs <= 0) {
            return true;
        }
        try {
            if (stopSignal == null) {
                Thread.sleep(waitMs);
                return true;
            }
            return !stopSignal.await(Duration.ofMillis(waitMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
