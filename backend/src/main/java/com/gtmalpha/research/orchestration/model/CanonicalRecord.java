package com.gtmalpha.research.orchestration.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record CanonicalRecord(
    String entityId,
    String name,
    String domain,
    Map<String, String> identity,
    Map<String, Object> fields,
    Map<String, String> fieldSources,
    List<FieldProvenance> provenance,
    List<String> contributingProviders,
    String finalProvider,
    BigDecimal totalCost,
    Instant aggregatedAt
) {
}
