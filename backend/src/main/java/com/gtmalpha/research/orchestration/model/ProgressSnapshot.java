package com.gtmalpha.research.orchestration.model;

import java.time.Instant;
import java.util.Map;

public record ProgressSnapshot(
    Long runId,
    boolean running,
    boolean stopRequested,
    Map<TaskState, Long> taskCounts,
    Map<String, BudgetSnapshot> spend,
    Map<String, CircuitSnapshot> circuits,
    CostReport costReport,
    Instant takenAt
) {
}
