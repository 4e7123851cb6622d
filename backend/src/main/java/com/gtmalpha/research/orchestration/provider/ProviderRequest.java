package com.gtmalpha.research.orchestration.provider;

import com.gtmalpha.research.orchestration.model.CompanyEntity;

public record ProviderRequest(CompanyEntity entity, int attemptNumber) {
}
