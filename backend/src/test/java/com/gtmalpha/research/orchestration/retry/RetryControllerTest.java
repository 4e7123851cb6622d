package com.gtmalpha.research.orchestration.retry;

import com.gtmalpha.research.orchestration.model.AttemptOutcome;
import com.gtmalpha.research.orchestration.service.StopSignal;
import com.gtmalpha.research.orchestration.util.OutcomeClassifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RetryControllerTest {
    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void retryableFailuresAreRetriedUntilExhausted() {
        RetryController retry = new RetryController(3, new BackoffPolicy(0, 0), Duration.ofSeconds(1), executor);
        AtomicInteger calls = new AtomicInteger();

        RetryResult<String> result = retry.execute("test", attempt -> {
            calls.incrementAndGet();
            return CallOutcome.of(AttemptOutcome.RETRYABLE_FAILURE, OutcomeClassifier.HTTP_5XX, null);
        }, new StopSignal());

        assertThat(result.status()).isEqualTo(RetryResult.Status.EXHAUSTED);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.last().reasonCode()).isEqualTo(OutcomeClassifier.HTTP_5XX);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void terminalFailureIsNotRetried() {
        RetryController retry = new RetryController(3, new BackoffPolicy(0, 0), Duration.ofSeconds(1), executor);
        AtomicInteger calls = new AtomicInteger();

        RetryResult<String> result = retry.execute("test", attempt -> {
            calls.incrementAndGet();
            return CallOutcome.of(AttemptOutcome.TERMINAL_FAILURE, OutcomeClassifier.HTTP_404, null);
        }, new StopSignal());

        assertThat(result.status()).isEqualTo(RetryResult.Status.SHORT_CIRCUITED);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void transientFailureThenSuccess() {
        RetryController retry = new RetryController(3, new BackoffPolicy(1, 2), Duration.ofSeconds(1), executor);

        RetryResult<String> result = retry.execute("test", attempt -> attempt == 1
            ? CallOutcome.of(AttemptOutcome.RETRYABLE_FAILURE, OutcomeClassifier.TIMEOUT, null)
            : CallOutcome.success("ok-" + attempt), new StopSignal());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.last().value()).isEqualTo("ok-2");
        assertThat(result.attempts()).isEqualTo(2);
    }

    @Test
    void stopDuringBackoffCancelsWithoutAnotherCall() {
        RetryController retry = new RetryController(5, new BackoffPolicy(60_000, 60_000), Duration.ofSeconds(1), executor);
        StopSignal stop = new StopSignal();
        AtomicInteger calls = new AtomicInteger();
        executor.submit(() -> {
            Thread.sleep(100);
            return stop.stop();
        });

        long started = System.nanoTime();
        RetryResult<String> result = retry.execute("test", attempt -> {
            calls.incrementAndGet();
            return CallOutcome.of(AttemptOutcome.RETRYABLE_FAILURE, OutcomeClassifier.HTTP_429_RATE_LIMIT, null);
        }, stop);

        assertThat(result.isCancelled()).isTrue();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void slowCallTimesOut() {
        RetryController retry = new RetryController(1, new BackoffPolicy(0, 0), Duration.ofMillis(50), executor);

        assertThrows(TimeoutException.class, () -> retry.invokeWithTimeout(() -> {
            Thread.sleep(5_000);
            return "late";
        }));
    }

    @Test
    void backoffDoublesWithJitterAndCap() {
        BackoffPolicy policy = new BackoffPolicy(100, 1_000);

        for (int i = 0; i < 50; i++) {
            assertThat(policy.delayMillis(1)).isBetween(50L, 99L);
            assertThat(policy.delayMillis(2)).isBetween(100L, 199L);
            assertThat(policy.delayMillis(10)).isBetween(500L, 999L);
        }
        assertThat(new BackoffPolicy(0, 1_000).delayMillis(3)).isZero();
    }
}
