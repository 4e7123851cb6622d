package com.gtmalpha.research.orchestration.delivery;

import com.gtmalpha.research.orchestration.model.DeliveryRecord;

import java.time.Instant;
import java.util.Optional;

public interface DeliveryRecordStore {
    Optional<DeliveryRecord> findDeliveryRecord(String idempotencyKey);

    void saveDeliveryRecord(String idempotencyKey, String entityId, String recordJson);

    void incrementDeliveryAttempts(String idempotencyKey);

    /**
     * Flips the acknowledgment flag if it is still unset. Returns false when another writer got
     * there first.
     */
    boolean markAcknowledged(String idempotencyKey, String ackId, Instant acknowledgedAt);
}
