package com.gtmalpha.research.orchestration.support;

import com.gtmalpha.research.orchestration.delivery.DeliveryResponse;
import com.gtmalpha.research.orchestration.delivery.DeliverySink;
import com.gtmalpha.research.orchestration.model.CanonicalRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

public class RecordingDeliverySink implements DeliverySink {
    private final Queue<DeliveryResponse> script = new ConcurrentLinkedQueue<>();
    private final List<CanonicalRecord> delivered = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger calls = new AtomicInteger();
    private volatile DeliveryResponse fallback;
    private volatile long sendDelayMillis;

    public RecordingDeliverySink then(DeliveryResponse response) {
        script.add(response);
        return this;
    }

    public RecordingDeliverySink always(DeliveryResponse response) {
        this.fallback = response;
        return this;
    }

    public RecordingDeliverySink withSendDelay(long millis) {
        this.sendDelayMillis = millis;
        return this;
    }

    public int calls() {
        return calls.get();
    }

    public List<CanonicalRecord> delivered() {
        synchronized (delivered) {
            return List.copyOf(delivered);
        }
    }

    @Override
    public DeliveryResponse deliver(String idempotencyKey, CanonicalRecord record, String recordJson) {
        int call = calls.incrementAndGet();
        if (sendDelayMillis > 0) {
            try {
                Thread.sleep(sendDelayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while sending", e);
            }
        }
        DeliveryResponse response = script.poll();
        if (response == null) {
            response = fallback != null ? fallback : DeliveryResponse.acknowledged("ack-" + call);
        }
        if (response.isAcknowledged()) {
            delivered.add(record);
        }
        return response;
    }
}
