package com.gtmalpha.research.orchestration.model;

import java.time.Instant;

public record ResearchRunMeta(long runId, Instant startedAt, Instant finishedAt, String status) {}
