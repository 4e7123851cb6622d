package com.gtmalpha.research.orchestration.model;

import java.util.List;

public record ResearchRunRequest(
    List<CompanyEntity> entities,
    Integer batchSize,
    Integer parallelism
) {
    public List<CompanyEntity> safeEntities() {
        return entities == null ? List.of() : entities;
    }
}
