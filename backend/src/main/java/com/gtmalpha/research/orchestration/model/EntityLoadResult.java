package com.gtmalpha.research.orchestration.model;

import java.util.List;

public record EntityLoadResult(
    List<CompanyEntity> entities,
    int skippedRows,
    List<String> sampleErrors
) {
}
