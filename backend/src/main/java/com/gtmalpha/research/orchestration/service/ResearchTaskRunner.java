package com.gtmalpha.research.orchestration.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gtmalpha.research.orchestration.aggregate.ResultAggregator;
import com.gtmalpha.research.orchestration.chain.AttemptRecorder;
import com.gtmalpha.research.orchestration.chain.ChainStep;
import com.gtmalpha.research.orchestration.chain.ProviderFallbackChain;
import com.gtmalpha.research.orchestration.delivery.DeliveryResult;
import com.gtmalpha.research.orchestration.delivery.IdempotentDeliveryService;
import com.gtmalpha.research.orchestration.model.CanonicalRecord;
import com.gtmalpha.research.orchestration.model.ProviderAttempt;
import com.gtmalpha.research.orchestration.model.StoredTask;
import com.gtmalpha.research.orchestration.model.TaskState;
import com.gtmalpha.research.orchestration.model.TerminalOutcome;
import com.gtmalpha.research.orchestration.persistence.ResearchJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.time.Clock;

/**
 * Drives one task through ADMIT, ACQUIRE (one provider per step), AGGREGATE and DELIVER. Each
 * {@link #advance} call performs exactly one step so the state machine can be exercised
 * step by step.
 */
public class ResearchTaskRunner {
    private static final Logger log = LoggerFactory.getLogger(ResearchTaskRunner.class);

    private final ProviderFallbackChain chain;
    private final ResultAggregator aggregator;
    private final IdempotentDeliveryService deliveryService;
    private final ResearchJdbcRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ResearchTaskRunner(
        ProviderFallbackChain chain,
        ResultAggregator aggregator,
        IdempotentDeliveryService deliveryService,
        ResearchJdbcRepository repository,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.chain = chain;
        this.aggregator = aggregator;
        this.deliveryService = deliveryService;
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void run(ResearchTask task, StopSignal stopSignal) {
        try {
            while (advance(task, stopSignal)) {
                // one step per iteration
            }
        } catch (RuntimeException e) {
            ResearchTask.Phase phase = task.phase();
            log.warn("Task {} failed unexpectedly during {}: {}", task.entity().entityId(), phase, e.toString());
            TerminalOutcome outcome = phase == ResearchTask.Phase.DELIVER
                ? TerminalOutcome.DELIVERY_FAILED
                : TerminalOutcome.UNREACHABLE;
            if (phase == ResearchTask.Phase.ADMIT) {
                outcome = TerminalOutcome.CANCELLED;
            }
            finish(task, outcome);
        }
    }

    public boolean advance(ResearchTask task, StopSignal stopSignal) {
        if (task.isTerminal()) {
            return false;
        }
        switch (task.phase()) {
            case ADMIT:
                if (task.start()) {
                    task.phase(ResearchTask.Phase.ACQUIRE);
                    persist(task);
                }
                return !task.isTerminal();
            case ACQUIRE:
                return acquire(task, stopSignal);
            case AGGREGATE:
                CanonicalRecord record = aggregator.aggregate(task.entity(), task.attempts());
                task.record(record);
                task.phase(ResearchTask.Phase.DELIVER);
                return true;
            case DELIVER:
                deliver(task, stopSignal);
                return false;
            case DONE:
            default:
                return false;
        }
    }

    private boolean acquire(ResearchTask task, StopSignal stopSignal) {
        if (task.providerIndex() >= chain.size()) {
            log.info(
                "Chain exhausted for {}: last provider {} ({})",
                task.entity().entityId(),
                task.lastProvider(),
                task.lastFailureDescription()
            );
            finish(task, TerminalOutcome.UNREACHABLE);
            return false;
        }
        ChainStep step = chain.attempt(task.providerIndex(), task.entity(), recorder(task), stopSignal);
        switch (step.kind()) {
            case ACCEPTED:
                task.phase(ResearchTask.Phase.AGGREGATE);
                return true;
            case CANCELLED:
                finish(task, TerminalOutcome.CANCELLED);
                return false;
            case QUALITY_REJECTED:
            case ESCALATE:
            default:
                task.nextProvider();
                return true;
        }
    }

    private void deliver(ResearchTask task, StopSignal stopSignal) {
        DeliveryResult result = deliveryService.deliver(task.record(), stopSignal);
        if (result.isAcknowledged()) {
            finish(task, TerminalOutcome.DELIVERED);
        } else if (result.status() == DeliveryResult.Status.CANCELLED) {
            finish(task, TerminalOutcome.CANCELLED);
        } else {
            task.recordDeliveryFailure(result.reasonCode());
            finish(task, TerminalOutcome.DELIVERY_FAILED);
        }
    }

    void finish(ResearchTask task, TerminalOutcome outcome) {
        if (task.state() == TaskState.PENDING
            && outcome != TerminalOutcome.CANCELLED) {
            task.start();
        }
        if (task.finish(outcome)) {
            log.info(
                "Task {} finished {} after {} attempts (cost {})",
                task.entity().entityId(),
                outcome,
                task.attempts().size(),
                task.totalCost()
            );
            persist(task);
        }
    }

    private AttemptRecorder recorder(ResearchTask task) {
        return (attempt, rawPayload) -> {
            ProviderAttempt kept = attempt;
            try {
                long rowId = repository.insertAttempt(task.entity().entityId(), task.runId(), attempt, rawPayload);
                kept = attempt.withPayloadRef(ResearchJdbcRepository.payloadRef(rowId));
            } catch (DataAccessException e) {
                log.warn("Could not store attempt {} of {} for {}: {}",
                    attempt.attemptNumber(), attempt.providerId(), task.entity().entityId(), e.getMessage());
            }
            task.addAttempt(kept);
            return kept;
        };
    }

    void persist(ResearchTask task) {
        try {
            repository.upsertTask(new StoredTask(
                task.entity().entityId(),
                task.runId(),
                task.entity().name(),
                task.entity().domain(),
                task.state(),
                task.outcome(),
                task.lastProvider(),
                task.lastFailureDescription(),
                recordJson(task.record()),
                task.totalCost(),
                clock.instant()
            ));
        } catch (DataAccessException e) {
            log.warn("Could not persist state {} of task {}: {}", task.state(), task.entity().entityId(), e.getMessage());
        }
    }

    private String recordJson(CanonicalRecord record) {
        if (record == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize canonical record for {}: {}", record.entityId(), e.getOriginalMessage());
            return null;
        }
    }
}
