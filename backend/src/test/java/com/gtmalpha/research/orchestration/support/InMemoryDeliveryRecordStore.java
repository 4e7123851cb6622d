package com.gtmalpha.research.orchestration.support;

import com.gtmalpha.research.orchestration.delivery.DeliveryRecordStore;
import com.gtmalpha.research.orchestration.model.DeliveryRecord;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDeliveryRecordStore implements DeliveryRecordStore {
    private final Map<String, DeliveryRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<DeliveryRecord> findDeliveryRecord(String idempotencyKey) {
        return Optional.ofNullable(records.get(idempotencyKey));
    }

    @Override
    public void saveDeliveryRecord(String idempotencyKey, String entityId, String recordJson) {
        records.compute(idempotencyKey, (key, current) -> {
            if (current == null) {
                return new DeliveryRecord(key, entityId, recordJson, false, null, null, 0);
            }
            if (current.acknowledged()) {
                return current;
            }
            return new DeliveryRecord(key, entityId, recordJson, false, null, null, current.deliveryAttempts());
        });
    }

    @Override
    public void incrementDeliveryAttempts(String idempotencyKey) {
        records.computeIfPresent(idempotencyKey, (key, current) -> new DeliveryRecord(
            key,
            current.entityId(),
            current.recordJson(),
            current.acknowledged(),
            current.ackId(),
            current.acknowledgedAt(),
            current.deliveryAttempts() + 1
        ));
    }

    @Override
    public boolean markAcknowledged(String idempotencyKey, String ackId, Instant acknowledgedAt) {
        boolean[] flipped = {false};
        records.computeIfPresent(idempotencyKey, (key, current) -> {
            if (current.acknowledged()) {
                return current;
            }
            flipped[0] = true;
            return new DeliveryRecord(
                key,
                current.entityId(),
                current.recordJson(),
                true,
                ackId,
                acknowledgedAt,
                current.deliveryAttempts()
            );
        });
        return flipped[0];
    }
}
