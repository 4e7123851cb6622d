package com.gtmalpha.research.orchestration.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ResearchRunSummary(
    long runId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    List<BatchReport> batches,
    Map<TerminalOutcome, Integer> outcomeCounts) {}
