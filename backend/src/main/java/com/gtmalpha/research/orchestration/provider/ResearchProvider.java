package com.gtmalpha.research.orchestration.provider;

import com.gtmalpha.research.orchestration.model.ProviderTier;

import java.math.BigDecimal;

/**
 * One data-acquisition capability in the fallback chain. Expected failures are reported through
 * {@link ProviderResponse}; anything thrown is treated as a terminal provider failure.
 */
public interface ResearchProvider {
    String id();

    String costClass();

    ProviderTier tier();

    BigDecimal estimatedCost();

    default QualityGate qualityGate() {
        return QualityGate.ACCEPT_ALL;
    }

    ProviderResponse attempt(ProviderRequest request);
}
