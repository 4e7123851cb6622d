package com.gtmalpha.research.orchestration.delivery;

import com.gtmalpha.research.orchestration.model.CanonicalRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingDeliverySink implements DeliverySink {
    private static final Logger log = LoggerFactory.getLogger(LoggingDeliverySink.class);

    @Override
    public DeliveryResponse deliver(String idempotencyKey, CanonicalRecord record, String recordJson) {
        log.info(
            "Delivery disabled; acknowledged {} locally ({} fields from {})",
            record.entityId(),
            record.fields().size(),
            record.contributingProviders()
        );
        return DeliveryResponse.acknowledged("local-" + idempotencyKey);
    }
}
