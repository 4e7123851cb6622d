package com.gtmalpha.research.orchestration.provider;

import com.gtmalpha.research.config.ResearchProperties;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class ProviderCostModel {
    private static final BigDecimal CHARS_PER_TOKEN = BigDecimal.valueOf(4);
    private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000L);
    private static final int SCALE = 6;

    private final ResearchProperties.CostModel model;
    private final BigDecimal flatCost;
    private final BigDecimal pricePerMillionTokens;

    public ProviderCostModel(ResearchProperties.CostModel model, BigDecimal flatCost, BigDecimal pricePerMillionTokens) {
        this.model = model == null ? ResearchProperties.CostModel.FLAT : model;
        this.flatCost = flatCost == null ? BigDecimal.ZERO : flatCost;
        this.pricePerMillionTokens = pricePerMillionTokens == null ? BigDecimal.ZERO : pricePerMillionTokens;
    }

    public static ProviderCostModel from(ResearchProperties.Provider provider) {
        return new ProviderCostModel(provider.getCostModel(), provider.getFlatCost(), provider.getPricePerMillionTokens());
    }

    public BigDecimal cost(BigDecimal reportedCost, int responseChars) {
        if (reportedCost != null && reportedCost.signum() >= 0) {
            return reportedCost;
        }
        if (model == ResearchProperties.CostModel.PER_TOKEN) {
            BigDecimal tokens = BigDecimal.valueOf(Math.max(0, responseChars)).divide(CHARS_PER_TOKEN, SCALE, RoundingMode.HALF_UP);
            return tokens.multiply(pricePerMillionTokens).divide(ONE_MILLION, SCALE, RoundingMode.HALF_UP);
        }
        return flatCost;
    }
}
