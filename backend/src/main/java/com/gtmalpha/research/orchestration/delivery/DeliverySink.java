package com.gtmalpha.research.orchestration.delivery;

import com.gtmalpha.research.orchestration.model.CanonicalRecord;

public interface DeliverySink {
    DeliveryResponse deliver(String idempotencyKey, CanonicalRecord record, String recordJson);
}
