package com.gtmalpha.research.orchestration.api;

import com.gtmalpha.research.orchestration.model.CompanyEntity;

import java.util.List;

public record ResearchApiRunRequest(
    List<CompanyEntity> entities,
    String csvPath,
    Integer limit,
    Integer batchSize,
    Integer parallelism
) {
}
