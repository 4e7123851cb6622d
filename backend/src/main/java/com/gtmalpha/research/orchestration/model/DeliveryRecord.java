package com.gtmalpha.research.orchestration.model;

import java.time.Instant;

public record DeliveryRecord(
    String idempotencyKey,
    String entityId,
    String recordJson,
    boolean acknowledged,
    String ackId,
    Instant acknowledgedAt,
    int deliveryAttempts
) {
}
