package com.gtmalpha.research.orchestration.delivery;

public record DeliveryResult(Status status, String idempotencyKey, String ackId, String reasonCode, int attempts) {
    public enum Status {
        ACKNOWLEDGED,
        ALREADY_ACKNOWLEDGED,
        FAILED,
        CANCELLED
    }

    public boolean isAcknowledged() {
        return status == Status.ACKNOWLEDGED || status == Status.ALREADY_ACKNOWLEDGED;
    }
}
