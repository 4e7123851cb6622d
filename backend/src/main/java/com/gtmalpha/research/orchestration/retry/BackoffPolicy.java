package com.gtmalpha.research.orchestration.retry;

import java.util.concurrent.ThreadLocalRandom;

public record BackoffPolicy(long baseDelayMs, long maxDelayMs) {
    public BackoffPolicy {
        baseDelayMs = Math.max(0L, baseDelayMs);
        maxDelayMs = Math.max(0L, maxDelayMs);
    }

    public long delayMillis(int attempt) {
        if (baseDelayMs <= 0) {
            return 0L;
        }
        long delay = baseDelayMs * (1L << Math.min(30, Math.max(0, attempt - 1)));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return 0L;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        return (delay / 2) + jitter;
    }
}
