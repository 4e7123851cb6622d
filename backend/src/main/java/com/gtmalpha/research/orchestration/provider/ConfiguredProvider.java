package com.gtmalpha.research.orchestration.provider;

import com.gtmalpha.research.config.ResearchProperties;
import com.gtmalpha.research.orchestration.model.ProviderTier;

import java.math.BigDecimal;

public abstract class ConfiguredProvider implements ResearchProvider {
    protected final ResearchProperties.Provider config;
    protected final ProviderCostModel costModel;
    private final QualityGate qualityGate;

    protected ConfiguredProvider(ResearchProperties.Provider config) {
        if (config.getId() == null || config.getId().isBlank()) {
            throw new IllegalArgumentException("research.providers[].id is required");
        }
        this.config = config;
        this.costModel = ProviderCostModel.from(config);
        this.qualityGate = FieldCoverageQualityGate.from(config.getQualityGate());
    }

    @Override
    public String id() {
        return config.getId();
    }

    @Override
    public String costClass() {
        return config.getCostClass();
    }

    @Override
    public ProviderTier tier() {
        return config.getTier();
    }

    @Override
    public BigDecimal estimatedCost() {
        return config.getEstimatedCost();
    }

    @Override
    public QualityGate qualityGate() {
        return qualityGate;
    }
}
