package com.gtmalpha.research.orchestration.delivery;

import com.gtmalpha.research.orchestration.model.AttemptOutcome;
import com.gtmalpha.research.orchestration.util.OutcomeClassifier;

public record DeliveryResponse(AttemptOutcome outcome, String ackId, String reasonCode) {
    public static DeliveryResponse acknowledged(String ackId) {
        return new DeliveryResponse(AttemptOutcome.SUCCESS, ackId, null);
    }

    public static DeliveryResponse failed(String reasonCode) {
        return new DeliveryResponse(OutcomeClassifier.classify(reasonCode), null, reasonCode);
    }

    public boolean isAcknowledged() {
        return outcome == AttemptOutcome.SUCCESS;
    }
}
