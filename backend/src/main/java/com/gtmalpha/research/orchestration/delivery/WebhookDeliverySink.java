package com.gtmalpha.research.orchestration.delivery;

import com.gtmalpha.research.config.ResearchProperties;
import com.gtmalpha.research.orchestration.http.PoliteHttpClient;
import com.gtmalpha.research.orchestration.model.CanonicalRecord;
import com.gtmalpha.research.orchestration.model.HttpFetchResult;
import com.gtmalpha.research.orchestration.util.OutcomeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

public class WebhookDeliverySink implements DeliverySink {
    private static final Logger log = LoggerFactory.getLogger(WebhookDeliverySink.class);

    private final ResearchProperties.Delivery properties;
    private final PoliteHttpClient httpClient;

    public WebhookDeliverySink(ResearchProperties.Delivery properties, PoliteHttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    @Override
    public DeliveryResponse deliver(String idempotencyKey, CanonicalRecord record, String recordJson) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Idempotency-Key", idempotencyKey);
        if (properties.getAuthToken() != null && !properties.getAuthToken().isBlank()) {
            headers.put("Authorization", "Bearer " + properties.getAuthToken());
        }
        HttpFetchResult result = httpClient.postJson(properties.getWebhookUrl(), recordJson, headers);
        if (result.isSuccessful()) {
            String ackId = result.header("X-Delivery-Id");
            return DeliveryResponse.acknowledged(ackId == null || ackId.isBlank() ? idempotencyKey : ackId.trim());
        }
        String reason = OutcomeClassifier.fromFetchResult(result);
        log.warn(
            "Webhook delivery of {} failed: status={} error={} reason={}",
            record.entityId(),
            result.statusCode(),
            result.errorCode(),
            reason
        );
        return DeliveryResponse.failed(reason);
    }
}
