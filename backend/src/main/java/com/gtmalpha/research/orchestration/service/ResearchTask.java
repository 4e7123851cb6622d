package com.gtmalpha.research.orchestration.service;

import com.gtmalpha.research.orchestration.model.AttemptOutcome;
import com.gtmalpha.research.orchestration.model.CanonicalRecord;
import com.gtmalpha.research.orchestration.model.CompanyEntity;
import com.gtmalpha.research.orchestration.model.ProviderAttempt;
import com.gtmalpha.research.orchestration.model.TaskReport;
import com.gtmalpha.research.orchestration.model.TaskState;
import com.gtmalpha.research.orchestration.model.TerminalOutcome;
import com.gtmalpha.research.orchestration.util.OutcomeClassifier;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

public class ResearchTask {
    public enum Phase {
        ADMIT,
        ACQUIRE,
        AGGREGATE,
        DELIVER,
        DONE
    }

    private final CompanyEntity entity;
    private final Long runId;
    private final List<ProviderAttempt> attempts = new ArrayList<>();
    private TaskState state = TaskState.PENDING;
    private TerminalOutcome outcome;
    private Phase phase = Phase.ADMIT;
    private int providerIndex;
    private CanonicalRecord record;
    private String lastProvider;
    private AttemptOutcome lastFailureKind;
    private String lastReasonCode;

    public ResearchTask(CompanyEntity entity, Long runId) {
        this.entity = entity;
        this.runId = runId;
    }

    public CompanyEntity entity() {
        return entity;
    }

    public Long runId() {
        return runId;
    }

    public synchronized TaskState state() {
        return state;
    }

    public synchronized TerminalOutcome outcome() {
        return outcome;
    }

    public synchronized boolean start() {
        return transition(TaskState.IN_FLIGHT, null);
    }

    public synchronized boolean finish(TerminalOutcome terminalOutcome) {
        return transition(terminalOutcome.taskState(), terminalOutcome);
    }

    public synchronized boolean abandon() {
        return finish(TerminalOutcome.CANCELLED);
    }

    public synchronized boolean isTerminal() {
        return state.isTerminal();
    }

    public synchronized void addAttempt(ProviderAttempt attempt) {
        attempts.add(attempt);
        lastProvider = attempt.providerId();
        if (!attempt.isSuccess()) {
            lastFailureKind = attempt.outcome();
            lastReasonCode = attempt.reasonCode();
        } else if (OutcomeClassifier.QUALITY_REJECTED.equals(attempt.reasonCode())) {
            // a rejected answer ends that provider's turn like a terminal failure
            lastFailureKind = AttemptOutcome.TERMINAL_FAILURE;
            lastReasonCode = attempt.reasonCode();
        }
    }

    public synchronized List<ProviderAttempt> attempts() {
        return List.copyOf(attempts);
    }

    public synchronized BigDecimal totalCost() {
        BigDecimal total = BigDecimal.ZERO;
        for (ProviderAttempt attempt : attempts) {
            total = total.add(attempt.cost());
        }
        return total;
    }

    public synchronized void recordDeliveryFailure(String reasonCode) {
        lastFailureKind = AttemptOutcome.TERMINAL_FAILURE;
        lastReasonCode = reasonCode;
    }

    public synchronized Phase phase() {
        return phase;
    }

    synchronized void phase(Phase next) {
        this.phase = next;
    }

    public synchronized int providerIndex() {
        return providerIndex;
    }

    synchronized void nextProvider() {
        providerIndex++;
    }

    public synchronized CanonicalRecord record() {
        return record;
    }

    synchronized void record(CanonicalRecord canonicalRecord) {
        this.record = canonicalRecord;
    }

    public synchronized String lastProvider() {
        return lastProvider;
    }

    public synchronized String lastFailureDescription() {
        if (lastFailureKind == null) {
            return null;
        }
        return lastReasonCode == null ? lastFailureKind.name() : lastFailureKind.name() + ":" + lastReasonCode;
    }

    public synchronized TaskReport report() {
        return new TaskReport(
            entity.entityId(),
            entity.name(),
            state,
            outcome,
            lastProvider,
            outcome == TerminalOutcome.DELIVERED ? null : lastFailureKind,
            outcome == TerminalOutcome.DELIVERED ? null : lastReasonCode,
            attempts.size(),
            totalCost(),
            false
        );
    }

    private boolean transition(TaskState next, TerminalOutcome terminalOutcome) {
        if (state.isTerminal()) {
            return false;
        }
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                "Task " + entity.entityId() + " cannot move from " + state + " to " + next
            );
        }
        state = next;
        if (terminalOutcome != null) {
            outcome = terminalOutcome;
            phase = Phase.DONE;
        }
        return true;
    }
}
