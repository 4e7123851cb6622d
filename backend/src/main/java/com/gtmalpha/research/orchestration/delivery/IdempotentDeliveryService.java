package com.gtmalpha.research.orchestration.delivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gtmalpha.research.orchestration.model.AttemptOutcome;
import com.gtmalpha.research.orchestration.model.CanonicalRecord;
import com.gtmalpha.research.orchestration.model.DeliveryRecord;
import com.gtmalpha.research.orchestration.retry.CallOutcome;
import com.gtmalpha.research.orchestration.retry.RetryController;
import com.gtmalpha.research.orchestration.retry.RetryResult;
import com.gtmalpha.research.orchestration.service.StopSignal;
import com.gtmalpha.research.orchestration.util.HashUtils;
import com.gtmalpha.research.orchestration.util.OutcomeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Check-then-send-then-mark delivery. The whole sequence for one idempotency key runs under the
 * key's lock stripe, and the acknowledgment is persisted before success is returned, so a crash can
 * cause at most a duplicate downstream send, never a lost record.
 */
public class IdempotentDeliveryService {
    private static final Logger log = LoggerFactory.getLogger(IdempotentDeliveryService.class);
    static final int LOCK_STRIPES = 64;

    private final DeliveryRecordStore store;
    private final DeliverySink sink;
    private final RetryController retryController;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Object[] keyLocks = new Object[LOCK_STRIPES];

    public IdempotentDeliveryService(
        DeliveryRecordStore store,
        DeliverySink sink,
        RetryController retryController,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.store = store;
        this.sink = sink;
        this.retryController = retryController;
        this.objectMapper = objectMapper;
        this.clock = clock;
        for (int i = 0; i < keyLocks.length; i++) {
            keyLocks[i] = new Object();
        }
    }

    public DeliveryResult deliver(CanonicalRecord record, StopSignal stopSignal) {
        String key = HashUtils.idempotencyKey(record.entityId());
        Object lock = lockFor(key);
        synchronized (lock) {
            Optional<DeliveryRecord> existing = store.findDeliveryRecord(key);
            if (existing.isPresent() && existing.get().acknowledged()) {
                log.debug("Record for {} already acknowledged as {}", record.entityId(), existing.get().ackId());
                return new DeliveryResult(DeliveryResult.Status.ALREADY_ACKNOWLEDGED, key, existing.get().ackId(), null, 0);
            }

            String json;
            try {
                json = objectMapper.writeValueAsString(record);
            } catch (JsonProcessingException e) {
                log.warn("Could not serialize canonical record for {}: {}", record.entityId(), e.getOriginalMessage());
                return new DeliveryResult(DeliveryResult.Status.FAILED, key, null, OutcomeClassifier.INVALID_PAYLOAD, 0);
            }
            store.saveDeliveryRecord(key, record.entityId(), json);

            RetryResult<DeliveryResponse> result = retryController.execute(
                "deliver " + record.entityId(),
                attemptNumber -> send(key, record, json),
                stopSignal
            );
            if (result.isSuccess()) {
                String ackId = result.last().value().ackId();
                if (!store.markAcknowledged(key, ackId, clock.instant())) {
                    DeliveryRecord current = store.findDeliveryRecord(key).orElse(null);
                    ackId = current == null || current.ackId() == null ? ackId : current.ackId();
                }
                log.info("Delivered {} (key={}, ack={})", record.entityId(), key, ackId);
                return new DeliveryResult(DeliveryResult.Status.ACKNOWLEDGED, key, ackId, null, result.attempts());
            }
            String reason = result.last() == null ? OutcomeClassifier.UNKNOWN : result.last().reasonCode();
            if (result.isCancelled()) {
                return new DeliveryResult(DeliveryResult.Status.CANCELLED, key, null, reason, result.attempts());
            }
            if (result.status() == RetryResult.Status.EXHAUSTED) {
                log.warn("Delivery of {} exhausted {} attempts (last reason {})", record.entityId(), result.attempts(), reason);
            } else {
                log.warn("Delivery of {} rejected downstream: {}", record.entityId(), reason);
            }
            return new DeliveryResult(DeliveryResult.Status.FAILED, key, null, reason, result.attempts());
        }
    }

    public Optional<DeliveryRecord> find(String entityId) {
        return store.findDeliveryRecord(HashUtils.idempotencyKey(entityId));
    }

    Object lockFor(String key) {
        return keyLocks[Math.floorMod(key.hashCode(), keyLocks.length)];
    }

    private CallOutcome<DeliveryResponse> send(String key, CanonicalRecord record, String json) {
        store.incrementDeliveryAttempts(key);
        DeliveryResponse response;
        try {
            response = sink.deliver(key, record, json);
        } catch (RuntimeException e) {
            log.warn("Delivery sink threw for {}: {}", record.entityId(), e.toString());
            response = new DeliveryResponse(AttemptOutcome.TERMINAL_FAILURE, null, OutcomeClassifier.SINK_EXCEPTION);
        }
        if (response == null) {
            response = DeliveryResponse.failed(OutcomeClassifier.UNKNOWN);
        }
        return CallOutcome.of(response.outcome(), response.reasonCode(), response);
    }
}
