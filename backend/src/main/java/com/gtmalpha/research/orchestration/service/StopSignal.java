package com.gtmalpha.research.orchestration.service;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class StopSignal {
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);

    public boolean stop() {
        if (stopped.compareAndSet(false, true)) {
            latch.countDown();
            return true;
        }
        return false;
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }
}
