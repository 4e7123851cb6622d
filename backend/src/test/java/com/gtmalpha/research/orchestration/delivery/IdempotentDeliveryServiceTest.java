package com.gtmalpha.research.orchestration.delivery;

import com.gtmalpha.research.orchestration.model.CanonicalRecord;
import com.gtmalpha.research.orchestration.model.DeliveryRecord;
import com.gtmalpha.research.orchestration.service.StopSignal;
import com.gtmalpha.research.orchestration.support.ResearchPipelineFixture;
import com.gtmalpha.research.orchestration.util.HashUtils;
import com.gtmalpha.research.orchestration.util.OutcomeClassifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class IdempotentDeliveryServiceTest {
    private ResearchPipelineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new ResearchPipelineFixture(List.of(), Map.of(), 3, null);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void secondDeliveryOfSameEntityIsServedFromStore() {
        CanonicalRecord record = record("zi-42");

        DeliveryResult first = fixture.delivery.deliver(record, new StopSignal());
        DeliveryResult second = fixture.delivery.deliver(record, new StopSignal());

        assertThat(first.status()).isEqualTo(DeliveryResult.Status.ACKNOWLEDGED);
        assertThat(second.status()).isEqualTo(DeliveryResult.Status.ALREADY_ACKNOWLEDGED);
        assertThat(second.ackId()).isEqualTo(first.ackId());
        assertThat(fixture.sink.calls()).isEqualTo(1);
        DeliveryRecord stored = fixture.delivery.find("zi-42").orElseThrow();
        assertThat(stored.acknowledged()).isTrue();
        assertThat(stored.idempotencyKey()).isEqualTo(HashUtils.idempotencyKey("zi-42"));
    }

    @Test
    void concurrentDeliveriesOfSameKeySendOnce() throws Exception {
        fixture.sink.withSendDelay(50);
        CanonicalRecord record = record("zi-7");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<DeliveryResult>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return fixture.delivery.deliver(record, new StopSignal());
                }));
            }
            start.countDown();
            int fresh = 0;
            for (Future<DeliveryResult> result : results) {
                DeliveryResult outcome = result.get(10, TimeUnit.SECONDS);
                assertThat(outcome.isAcknowledged()).isTrue();
                if (outcome.status() == DeliveryResult.Status.ACKNOWLEDGED) {
                    fresh++;
                }
            }

            assertThat(fresh).isEqualTo(1);
            assertThat(fixture.sink.calls()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void keyLocksStayBoundedAcrossManyEntities() {
        Set<Object> locks = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < 500; i++) {
            CanonicalRecord record = record("zi-" + i);
            assertThat(fixture.delivery.deliver(record, new StopSignal()).isAcknowledged()).isTrue();
            locks.add(fixture.delivery.lockFor(HashUtils.idempotencyKey(record.entityId())));
        }

        assertThat(fixture.sink.calls()).isEqualTo(500);
        assertThat(locks).hasSizeLessThanOrEqualTo(IdempotentDeliveryService.LOCK_STRIPES);
        String key = HashUtils.idempotencyKey("zi-7");
        assertThat(fixture.delivery.lockFor(key)).isSameAs(fixture.delivery.lockFor(key));
    }

    @Test
    void transientSinkFailureIsRetried() {
        fixture.sink.then(DeliveryResponse.failed(OutcomeClassifier.HTTP_5XX));

        DeliveryResult result = fixture.delivery.deliver(record("zi-9"), new StopSignal());

        assertThat(result.status()).isEqualTo(DeliveryResult.Status.ACKNOWLEDGED);
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(fixture.delivery.find("zi-9").orElseThrow().deliveryAttempts()).isEqualTo(2);
    }

    @Test
    void persistentSinkFailureExhaustsRetries() {
        fixture.sink.always(DeliveryResponse.failed(OutcomeClassifier.HTTP_429_RATE_LIMIT));

        DeliveryResult result = fixture.delivery.deliver(record("zi-9"), new StopSignal());

        assertThat(result.status()).isEqualTo(DeliveryResult.Status.FAILED);
        assertThat(result.reasonCode()).isEqualTo(OutcomeClassifier.HTTP_429_RATE_LIMIT);
        assertThat(fixture.sink.calls()).isEqualTo(3);
        assertThat(fixture.delivery.find("zi-9").orElseThrow().acknowledged()).isFalse();
    }

    @Test
    void rejectedPayloadIsNotRetried() {
        fixture.sink.always(DeliveryResponse.failed(OutcomeClassifier.INVALID_REQUEST));

        DeliveryResult result = fixture.delivery.deliver(record("zi-9"), new StopSignal());

        assertThat(result.status()).isEqualTo(DeliveryResult.Status.FAILED);
        assertThat(fixture.sink.calls()).isEqualTo(1);
    }

    @Test
    void failedDeliveryCanBeRetriedLater() {
        fixture.sink.then(DeliveryResponse.failed(OutcomeClassifier.INVALID_REQUEST));
        CanonicalRecord record = record("zi-3");

        DeliveryResult first = fixture.delivery.deliver(record, new StopSignal());
        DeliveryResult second = fixture.delivery.deliver(record, new StopSignal());

        assertThat(first.status()).isEqualTo(DeliveryResult.Status.FAILED);
        assertThat(second.status()).isEqualTo(DeliveryResult.Status.ACKNOWLEDGED);
        assertThat(fixture.sink.delivered()).hasSize(1);
    }

    @Test
    void idempotencyKeyIsStablePerEntity() {
        assertThat(HashUtils.idempotencyKey("zi-1")).isEqualTo(HashUtils.idempotencyKey(" zi-1 "));
        assertThat(HashUtils.idempotencyKey("zi-1")).isNotEqualTo(HashUtils.idempotencyKey("zi-2"));
        assertThat(HashUtils.idempotencyKey("zi-1")).startsWith("research-").hasSize(41);
    }

    private CanonicalRecord record(String entityId) {
        return new CanonicalRecord(
            entityId,
            "Acme",
            "acme.com",
            Map.of("entity_id", entityId),
            Map.of("title", "Acme"),
            Map.of("title", "scraper"),
            List.of(),
            List.of("scraper"),
            "scraper",
            new BigDecimal("0.001"),
            Instant.parse("2026-03-02T10:00:00Z")
        );
    }
}
