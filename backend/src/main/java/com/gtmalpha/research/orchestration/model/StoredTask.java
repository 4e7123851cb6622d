package com.gtmalpha.research.orchestration.model;

import java.math.BigDecimal;
import java.time.Instant;

public record StoredTask(
    String entityId,
    Long runId,
    String name,
    String domain,
    TaskState state,
    TerminalOutcome outcome,
    String lastProvider,
    String lastFailureKind,
    String canonicalRecordJson,
    BigDecimal totalCost,
    Instant updatedAt
) {
}
