package com.gtmalpha.research.orchestration.chain;

import com.gtmalpha.research.orchestration.budget.BudgetLedger;
import com.gtmalpha.research.orchestration.budget.BudgetReservation;
import com.gtmalpha.research.orchestration.circuit.ProviderCircuit;
import com.gtmalpha.research.orchestration.circuit.ProviderCircuitBreakers;
import com.gtmalpha.research.orchestration.model.AttemptOutcome;
import com.gtmalpha.research.orchestration.model.CompanyEntity;
import com.gtmalpha.research.orchestration.model.ProviderAttempt;
import com.gtmalpha.research.orchestration.provider.ProviderRegistry;
import com.gtmalpha.research.orchestration.provider.ProviderRequest;
import com.gtmalpha.research.orchestration.provider.ProviderResponse;
import com.gtmalpha.research.orchestration.provider.ResearchProvider;
import com.gtmalpha.research.orchestration.retry.CallOutcome;
import com.gtmalpha.research.orchestration.retry.RetryController;
import com.gtmalpha.research.orchestration.retry.RetryResult;
import com.gtmalpha.research.orchestration.service.StopSignal;
import com.gtmalpha.research.orchestration.util.OutcomeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

public class ProviderFallbackChain {
    private static final Logger log = LoggerFactory.getLogger(ProviderFallbackChain.class);

    private final ProviderRegistry registry;
    private final BudgetLedger ledger;
    private final ProviderCircuitBreakers circuits;
    private final RetryController retryController;
    private final Clock clock;

    public ProviderFallbackChain(
        ProviderRegistry registry,
        BudgetLedger ledger,
        ProviderCircuitBreakers circuits,
        RetryController retryController,
        Clock clock
    ) {
        this.registry = registry;
        this.ledger = ledger;
        this.circuits = circuits;
        this.retryController = retryController;
        this.clock = clock;
    }

    public int size() {
        return registry.providers().size();
    }

    public List<ResearchProvider> providers() {
        return registry.providers();
    }

    public ChainStep attempt(int providerIndex, CompanyEntity entity, AttemptRecorder recorder, StopSignal stopSignal) {
        ResearchProvider provider = registry.providers().get(providerIndex);
        if (stopSignal != null && stopSignal.isStopped()) {
            return new ChainStep(ChainStep.Kind.CANCELLED, provider.id(), null);
        }
        RetryResult<ProviderAttempt> result = retryController.execute(
            provider.id() + " for " + entity.entityId(),
            attemptNumber -> tryOnce(provider, entity, attemptNumber, recorder),
            stopSignal
        );
        ProviderAttempt last = result.last() == null ? null : result.last().value();
        switch (result.status()) {
            case SUCCEEDED:
                if (last != null && last.qualityAccepted()) {
                    return new ChainStep(ChainStep.Kind.ACCEPTED, provider.id(), last);
                }
                log.info("Quality gate rejected {} result for {}, escalating", provider.id(), entity.entityId());
                return new ChainStep(ChainStep.Kind.QUALITY_REJECTED, provider.id(), last);
            case CANCELLED:
                return new ChainStep(ChainStep.Kind.CANCELLED, provider.id(), last);
            case EXHAUSTED:
                log.info(
                    "Provider {} exhausted {} attempts for {} (last reason {}), escalating",
                    provider.id(),
                    result.attempts(),
                    entity.entityId(),
                    last == null ? null : last.reasonCode()
                );
                return new ChainStep(ChainStep.Kind.ESCALATE, provider.id(), last);
            case SHORT_CIRCUITED:
            default:
                log.debug(
                    "Provider {} skipped or failed for {} with {} {}",
                    provider.id(),
                    entity.entityId(),
                    last == null ? null : last.outcome(),
                    last == null ? null : last.reasonCode()
                );
                return new ChainStep(ChainStep.Kind.ESCALATE, provider.id(), last);
        }
    }

    private CallOutcome<ProviderAttempt> tryOnce(
        ResearchProvider provider,
        CompanyEntity entity,
        int attemptNumber,
        AttemptRecorder recorder
    ) throws InterruptedException {
        Instant startedAt = clock.instant();
        Optional<BudgetReservation> reservation = ledger.reserve(provider.costClass(), provider.estimatedCost());
        if (reservation.isEmpty()) {
            return skip(provider, attemptNumber, AttemptOutcome.BUDGET_BLOCKED, OutcomeClassifier.BUDGET_CAP_REACHED, recorder);
        }
        ProviderCircuit circuit = circuits.circuit(provider.id());
        if (!circuit.tryAcquire()) {
            reservation.get().release();
            return skip(provider, attemptNumber, AttemptOutcome.CIRCUIT_OPEN, OutcomeClassifier.CIRCUIT_OPEN, recorder);
        }

        ProviderResponse response;
        BigDecimal cost;
        try {
            response = retryController.invokeWithTimeout(() -> provider.attempt(new ProviderRequest(entity, attemptNumber)));
            cost = response.cost();
        } catch (TimeoutException e) {
            // an abandoned call is charged its estimate
            response = ProviderResponse.retryable(OutcomeClassifier.TIMEOUT);
            cost = provider.estimatedCost();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Provider {} threw for {}: {}", provider.id(), entity.entityId(), cause.toString());
            response = ProviderResponse.terminal(OutcomeClassifier.PROVIDER_EXCEPTION);
            cost = BigDecimal.ZERO;
        } catch (InterruptedException e) {
            reservation.get().release();
            circuit.releaseProbe();
            throw e;
        }
        BigDecimal charged = reservation.get().commit(cost);
        if (charged.compareTo(cost) < 0) {
            log.warn(
                "Provider {} reported cost {} for {} above its {} reservation; charging the reservation",
                provider.id(),
                cost,
                entity.entityId(),
                provider.estimatedCost()
            );
            cost = charged;
        }
        if (response.isSuccess()) {
            circuit.recordSuccess();
        } else {
            circuit.recordFailure();
        }

        boolean accepted = response.isSuccess() && passesQualityGate(provider, entity, response);
        String reasonCode = response.isSuccess() && !accepted ? OutcomeClassifier.QUALITY_REJECTED : response.reasonCode();
        ProviderAttempt attempt = new ProviderAttempt(
            provider.id(),
            provider.costClass(),
            attemptNumber,
            startedAt,
            clock.instant(),
            response.outcome(),
            reasonCode,
            cost,
            null,
            response.isSuccess() ? response.content() : null,
            accepted
        );
        ProviderAttempt recorded = recorder.record(attempt, response.rawPayload());
        return CallOutcome.of(response.outcome(), reasonCode, recorded);
    }

    private boolean passesQualityGate(ResearchProvider provider, CompanyEntity entity, ProviderResponse response) {
        try {
            return provider.qualityGate().accept(entity, response.content());
        } catch (RuntimeException e) {
            log.warn("Quality gate for {} failed on {}: {}", provider.id(), entity.entityId(), e.toString());
            return false;
        }
    }

    private CallOutcome<ProviderAttempt> skip(
        ResearchProvider provider,
        int attemptNumber,
        AttemptOutcome outcome,
        String reasonCode,
        AttemptRecorder recorder
    ) {
        ProviderAttempt attempt = ProviderAttempt.skipped(
            provider.id(),
            provider.costClass(),
            attemptNumber,
            outcome,
            reasonCode,
            clock.instant()
        );
        return CallOutcome.of(outcome, reasonCode, recorder.record(attempt, null));
    }
}
