package com.gtmalpha.research.orchestration.delivery;

import com.gtmalpha.research.config.ResearchProperties;
import com.gtmalpha.research.orchestration.http.PoliteHttpClient;
import com.gtmalpha.research.orchestration.model.AttemptOutcome;
import com.gtmalpha.research.orchestration.model.CanonicalRecord;
import com.gtmalpha.research.orchestration.util.OutcomeClassifier;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookDeliverySinkTest {
    private static final String KEY = "research-0123456789abcdef0123456789abcdef";
    private static final CanonicalRecord RECORD = new CanonicalRecord(
        "zi-1",
        "Acme Analytics",
        "acme.com",
        Map.of("name", "Acme Analytics", "domain", "acme.com"),
        Map.of("title", "Acme"),
        Map.of("title", "homepage"),
        List.of(),
        List.of("homepage"),
        "homepage",
        new BigDecimal("0.0001"),
        Instant.parse("2026-03-02T10:00:00Z")
    );

    private MockWebServer server;
    private ExecutorService executor;
    private WebhookDeliverySink sink;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        ResearchProperties properties = new ResearchProperties();
        properties.getHttp().setPerHostDelayMs(1);
        properties.getHttp().setRequestTimeoutSeconds(5);
        properties.getDelivery().setEnabled(true);
        properties.getDelivery().setWebhookUrl(server.url("/hooks/research").toString());
        properties.getDelivery().setAuthToken("crm-token");
        executor = Executors.newFixedThreadPool(1);
        sink = new WebhookDeliverySink(properties.getDelivery(), new PoliteHttpClient(properties, executor));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void acknowledgmentIdComesFromReceiver() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(201).setHeader("X-Delivery-Id", "crm-778"));

        DeliveryResponse response = sink.deliver(KEY, RECORD, "{\"entityId\":\"zi-1\"}");

        assertThat(response.isAcknowledged()).isTrue();
        assertThat(response.ackId()).isEqualTo("crm-778");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/hooks/research");
        assertThat(request.getHeader("Idempotency-Key")).isEqualTo(KEY);
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer crm-token");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"entityId\":\"zi-1\"}");
    }

    @Test
    void idempotencyKeyDoublesAsAckIdWhenReceiverSendsNone() {
        server.enqueue(new MockResponse().setResponseCode(200));

        DeliveryResponse response = sink.deliver(KEY, RECORD, "{}");

        assertThat(response.ackId()).isEqualTo(KEY);
    }

    @Test
    void unavailableReceiverIsRetryable() {
        server.enqueue(new MockResponse().setResponseCode(503));

        DeliveryResponse response = sink.deliver(KEY, RECORD, "{}");

        assertThat(response.isAcknowledged()).isFalse();
        assertThat(response.outcome()).isEqualTo(AttemptOutcome.RETRYABLE_FAILURE);
        assertThat(response.reasonCode()).isEqualTo(OutcomeClassifier.HTTP_5XX);
    }

    @Test
    void conflictIsTerminal() {
        server.enqueue(new MockResponse().setResponseCode(409).setBody("duplicate"));

        DeliveryResponse response = sink.deliver(KEY, RECORD, "{}");

        assertThat(response.outcome()).isEqualTo(AttemptOutcome.TERMINAL_FAILURE);
        assertThat(response.reasonCode()).isEqualTo(OutcomeClassifier.HTTP_4XX);
    }
}
