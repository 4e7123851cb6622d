package com.gtmalpha.research.orchestration.model;

public record FieldProvenance(
    String field,
    String providerId,
    int attemptNumber,
    Object value,
    boolean superseded
) {
}
