package com.gtmalpha.research.orchestration.model;

import java.math.BigDecimal;

public record TaskReport(
    String entityId,
    String name,
    TaskState state,
    TerminalOutcome outcome,
    String lastProvider,
    AttemptOutcome lastFailureKind,
    String lastReasonCode,
    int attemptCount,
    BigDecimal totalCost,
    boolean resumed
) {
}
